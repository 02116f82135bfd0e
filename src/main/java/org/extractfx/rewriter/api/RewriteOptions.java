package org.extractfx.rewriter.api;

import com.typesafe.config.Config;

/**
 * Caller-supplied settings for one rewrite run.
 *
 * @param functionName The call emitted around {@code f} literals. A trailing {@code *} is
 *                     replaced by the number of extracted arguments.
 * @param emitLocationMarkers Whether {@code #line} markers are emitted around rewritten calls.
 * @param sourcePath The path written into location markers.
 */
public record RewriteOptions(
        String functionName,
        boolean emitLocationMarkers,
        String sourcePath
) {
    /** The call used when nothing else is configured. */
    public static final String DEFAULT_FUNCTION_NAME = "std::format";

    private static final String FUNCTION_NAME_KEY = "function-name";
    private static final String LOCATION_MARKERS_KEY = "location-markers";

    public RewriteOptions {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        if (sourcePath == null) {
            sourcePath = "";
        }
    }

    /**
     * @return Options with the default function name and no location markers.
     */
    public static RewriteOptions defaults() {
        return new RewriteOptions(DEFAULT_FUNCTION_NAME, false, "");
    }

    /**
     * Reads options from the {@code extractfx} block of the application configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The {@code extractfx} configuration block.
     * @param sourcePath The path of the file being rewritten.
     * @return The resulting options.
     */
    public static RewriteOptions fromConfig(Config config, String sourcePath) {
        String name = config.hasPath(FUNCTION_NAME_KEY) ? config.getString(FUNCTION_NAME_KEY) : DEFAULT_FUNCTION_NAME;
        boolean markers = config.hasPath(LOCATION_MARKERS_KEY) && config.getBoolean(LOCATION_MARKERS_KEY);
        return new RewriteOptions(name, markers, sourcePath);
    }

    public RewriteOptions withFunctionName(String name) {
        return new RewriteOptions(name, emitLocationMarkers, sourcePath);
    }

    public RewriteOptions withLocationMarkers(boolean enabled) {
        return new RewriteOptions(functionName, enabled, sourcePath);
    }

    public RewriteOptions withSourcePath(String path) {
        return new RewriteOptions(functionName, emitLocationMarkers, path);
    }
}
