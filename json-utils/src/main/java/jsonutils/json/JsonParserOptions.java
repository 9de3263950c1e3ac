package jsonutils.json;

import java.util.logging.Logger;

/// Tuning options for a parse.
///
/// The only option is the maximum nesting depth of objects and arrays. Its
/// default can be set with the system property {@code jsonutils.parser.maxDepth};
/// documents nested deeper than the limit fail with an {@link InvalidJsonException}
/// rather than exhausting the call stack.
public final class JsonParserOptions {

    private static final Logger LOGGER = Logger.getLogger(JsonParserOptions.class.getName());

    /// System property key for the default maximum nesting depth
    public static final String MAX_DEPTH_PROPERTY = "jsonutils.parser.maxDepth";

    /// Depth used when the system property is absent or invalid
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final JsonParserOptions DEFAULTS = new JsonParserOptions(configuredMaxDepth());

    private final int maxDepth;

    private JsonParserOptions(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /// {@return the options taken from system properties, or built-in defaults}
    public static JsonParserOptions defaults() {
        return DEFAULTS;
    }

    /// {@return a copy of these options with the given maximum nesting depth}
    ///
    /// @param maxDepth the number of objects and arrays that may be open at once
    /// @throws IllegalArgumentException if `maxDepth` is less than 1
    public JsonParserOptions withMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        return new JsonParserOptions(maxDepth);
    }

    /// {@return the maximum nesting depth}
    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public String toString() {
        return "JsonParserOptions[maxDepth=" + maxDepth + "]";
    }

    static int configuredMaxDepth() {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        if (propertyValue == null) {
            LOGGER.fine(() -> "Max depth not specified, using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        int depth;
        try {
            depth = Integer.parseInt(propertyValue.trim());
        } catch (NumberFormatException e) {
            depth = -1;
        }
        if (depth >= 1) {
            final int configured = depth;
            LOGGER.fine(() -> "Max depth set to " + configured + " via system property");
            return configured;
        }
        LOGGER.warning(() -> "Invalid max depth: " + propertyValue
                + ". Using default: " + DEFAULT_MAX_DEPTH);
        return DEFAULT_MAX_DEPTH;
    }
}
