package cli;

public enum OutputFormat {
    MERMAID,
    JSON
}
