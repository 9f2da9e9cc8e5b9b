package json.descent;

import java.util.logging.Logger;

/// Parser settings resolved once from system properties.
///
/// The maximum nesting depth can be configured via the system property
/// {@code json.descent.maxDepth}. Values that are not positive integers are ignored with a warning.
public final class ParserConfig {

    private static final Logger LOG = Logger.getLogger(ParserConfig.class.getName());

    /// System property key for the maximum object/array nesting depth
    public static final String MAX_DEPTH_PROPERTY = "json.descent.maxDepth";

    /// Depth used when the property is absent or invalid
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final ParserConfig DEFAULTS = new ParserConfig(resolveMaxDepth(System.getProperty(MAX_DEPTH_PROPERTY)));

    private final int maxDepth;

    private ParserConfig(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /// Returns the configuration read from system properties at class initialization.
    public static ParserConfig defaults() {
        return DEFAULTS;
    }

    /// Maximum number of nested objects and arrays a single parse may enter.
    public int maxDepth() {
        return maxDepth;
    }

    static int resolveMaxDepth(String propertyValue) {
        if (propertyValue == null) {
            LOG.fine(() -> "Max depth not specified, using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        try {
            final int depth = Integer.parseInt(propertyValue.trim());
            if (depth > 0) {
                LOG.fine(() -> "Max depth set to " + depth + " via system property");
                return depth;
            }
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                + ". Using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        LOG.warning(() -> MAX_DEPTH_PROPERTY + " must be positive, got: " + propertyValue
            + ". Using default: " + DEFAULT_MAX_DEPTH);
        return DEFAULT_MAX_DEPTH;
    }
}
