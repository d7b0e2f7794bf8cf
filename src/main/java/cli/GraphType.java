package cli;

public enum GraphType {
    CFG,
    DFG
}
