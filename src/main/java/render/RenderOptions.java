package render;

/**
 * Switches for the diagram renderer. The defaults draw every node.
 */
public class RenderOptions {
    private final boolean includeHidden;
    private final boolean includeStartStop;

    public RenderOptions(boolean includeHidden, boolean includeStartStop) {
        this.includeHidden = includeHidden;
        this.includeStartStop = includeStartStop;
    }

    public static RenderOptions defaults() {
        return new RenderOptions(true, true);
    }

    public boolean isIncludeHidden() { return includeHidden; }
    public boolean isIncludeStartStop() { return includeStartStop; }
}
