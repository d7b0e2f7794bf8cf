package sanalysis;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stack of frontiers. A frontier is the ordered set of node ids most recently executed
 * (or computed) along every live path; new nodes take it as their predecessors.
 */
public class FrontierStack {
    private final Deque<Set<Integer>> stack = new ArrayDeque<>();

    public FrontierStack() {
        pushEmpty();
    }

    public void push(Collection<Integer> frontier) {
        stack.push(new LinkedHashSet<>(frontier));
    }

    public void pushEmpty() {
        stack.push(new LinkedHashSet<>());
    }

    /** Pushes a copy of the current frontier. */
    public void duplicate() {
        push(peek());
    }

    public Set<Integer> pop() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Frontier stack is empty");
        }
        return stack.pop();
    }

    public Set<Integer> peek() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Frontier stack is empty");
        }
        return Collections.unmodifiableSet(stack.peek());
    }

    public void add(int id) {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Frontier stack is empty");
        }
        stack.peek().add(id);
    }

    public void addAll(Collection<Integer> ids) {
        for (Integer id : ids) {
            add(id);
        }
    }

    public int depth() {
        return stack.size();
    }
}
