package graph;

/**
 * Semantic role of a node. The first group belongs to control flow graphs,
 * the second to data flow graphs.
 */
public enum NodeType {
    START,
    STOP,
    DEFINITION,
    IF,
    IF_TRUE,
    IF_FALSE,
    STATEMENT,

    CONSTANT,
    NAME,
    OP;

    public boolean isControlFlow() {
        return ordinal() <= STATEMENT.ordinal();
    }
}
