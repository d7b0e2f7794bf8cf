package sanalysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nested name bindings, outermost scope first. Each binding maps a name to the id of the
 * node holding its most recent value.
 */
public class ScopeChain {
    private final List<Map<String, Integer>> scopes = new ArrayList<>();

    public ScopeChain() {
        scopes.add(new LinkedHashMap<>());
    }

    public void enter() {
        scopes.add(new LinkedHashMap<>());
    }

    public void exit() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot exit the root scope");
        }
        scopes.remove(scopes.size() - 1);
    }

    public Optional<Integer> lookup(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Integer id = scopes.get(i).get(name);
            if (id != null) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Rebinds the nearest scope that already knows {@code name}, or binds it in the
     * innermost scope.
     */
    public void assign(String name, int id) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Map<String, Integer> scope = scopes.get(i);
            if (scope.containsKey(name)) {
                scope.put(name, id);
                return;
            }
        }
        innermost().put(name, id);
    }

    /** Binds {@code name} in the innermost scope, shadowing outer bindings. */
    public void declare(String name, int id) {
        innermost().put(name, id);
    }

    public int depth() {
        return scopes.size();
    }

    public Map<String, Integer> snapshotRoot() {
        return new LinkedHashMap<>(scopes.get(0));
    }

    private Map<String, Integer> innermost() {
        return scopes.get(scopes.size() - 1);
    }
}
