package org.extractfx.rewriter.backend;

import org.extractfx.rewriter.frontend.SourcePosition;

/**
 * Renders {@code #line} markers that map emitted text back to its original position.
 * <p>
 * A marker starts on a fresh line and is followed by enough spaces that the next emitted
 * character lands in its original column.
 */
public final class LocationMarker {

    private LocationMarker() {}

    /**
     * @param position The original position of the text that follows the marker.
     * @param path The source path. Quotes and backslashes are escaped.
     * @return The marker text.
     */
    public static String render(SourcePosition position, String path) {
        return render(position.line(), position.column(), path);
    }

    /**
     * @param line The original line of the text that follows the marker.
     * @param column The original column of that text, 1-based.
     * @param path The source path.
     * @return The marker text.
     */
    public static String render(int line, int column, String path) {
        return "\n#line " + line + " \"" + escape(path) + "\"\n" + " ".repeat(Math.max(0, column - 1));
    }

    private static String escape(String path) {
        return path.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
