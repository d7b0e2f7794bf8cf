package parsing;

import java.util.Collections;
import java.util.List;

/**
 * Raised when source text is neither a compilation unit nor a statement snippet.
 */
public class SourceParseException extends Exception {
    private final List<String> problems;

    public SourceParseException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + problems.get(0)));
        this.problems = Collections.unmodifiableList(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
