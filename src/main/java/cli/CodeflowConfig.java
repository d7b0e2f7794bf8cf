package cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Defaults for the launcher, read from {@code config.properties} on the classpath.
 * Command line options override every value.
 */
public class CodeflowConfig {
    private static final Logger logger = LoggerFactory.getLogger(CodeflowConfig.class);

    static final String RESOURCE = "config.properties";

    private final Properties props;

    public CodeflowConfig(Properties props) {
        this.props = props;
    }

    public static CodeflowConfig load() {
        Properties props = new Properties();
        try (InputStream input = CodeflowConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.warn("{} not found; using default settings.", RESOURCE);
            }
        } catch (IOException e) {
            logger.error("Error loading {}", RESOURCE, e);
        }
        return new CodeflowConfig(props);
    }

    public GraphType getGraphType() {
        return parseEnum(GraphType.class, "graph.type", GraphType.DFG);
    }

    public OutputFormat getOutputFormat() {
        return parseEnum(OutputFormat.class, "output.format", OutputFormat.MERMAID);
    }

    public boolean isIncludeHidden() {
        return Boolean.parseBoolean(props.getProperty("render.include-hidden", "true").trim());
    }

    public boolean isIncludeStartStop() {
        return Boolean.parseBoolean(props.getProperty("render.include-start-stop", "true").trim());
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String key, E fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring invalid value '{}' for {}; using {}", value, key, fallback);
            return fallback;
        }
    }
}
