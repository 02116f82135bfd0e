package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteException;
import org.extractfx.rewriter.api.RewriteOptions;

import java.io.IOException;

/**
 * State shared by all scanners working on one input: the cursor, the options and whether the
 * driver is currently inside a preprocessor directive.
 */
public class ScanContext {

    private final SourceCursor cursor;
    private final RewriteOptions options;
    private boolean inDirective = false;

    /**
     * @param cursor The cursor all scanners read from.
     * @param options The options of this run.
     */
    public ScanContext(SourceCursor cursor, RewriteOptions options) {
        this.cursor = cursor;
        this.options = options;
    }

    public SourceCursor cursor() {
        return cursor;
    }

    public RewriteOptions options() {
        return options;
    }

    public boolean isInDirective() {
        return inDirective;
    }

    public void setInDirective(boolean inDirective) {
        this.inDirective = inDirective;
    }

    /**
     * Location markers cannot be placed inside a directive.
     * @return {@code true} if markers should be emitted at the current position.
     */
    public boolean markersEnabled() {
        return options.emitLocationMarkers() && !inDirective;
    }

    /**
     * Creates a malformed-construct error for the current line.
     * @param message The description of the violation.
     * @return The exception to throw.
     */
    public RewriteException malformed(String message) {
        return RewriteException.malformed(cursor.getLineNumber(), message);
    }

    /**
     * Checks whether the backslash at the cursor splices lines, meaning only blanks follow it
     * up to the end of the line or the end of the input.
     * @return {@code true} for a line splice.
     * @throws IOException if the input cannot be read.
     */
    public boolean atLineSplice() throws IOException {
        int i = 1;
        while (cursor.hasChar(i) && isBlank(cursor.peek(i))) {
            i++;
        }
        return !cursor.hasChar(i) || cursor.peek(i) == SourceCursor.EOL;
    }

    /**
     * Copies a line splice (backslash, blanks and end of line) and moves to the next line.
     * @param out Receives the copied characters.
     * @param where Names the construct being scanned, for the error message.
     * @throws RewriteException if the input ends after the backslash.
     * @throws IOException if the input cannot be read.
     */
    public void copyLineSplice(StringBuilder out, String where) throws RewriteException, IOException {
        out.append(cursor.next());
        while (isBlank(cursor.peek())) {
            out.append(cursor.next());
        }
        if (cursor.peek() != SourceCursor.EOL) {
            throw RewriteException.prematureEnd("Input ends with a \\ last on a line inside " + where + ".");
        }
        out.append(cursor.next());
        if (cursor.atEnd()) {
            throw RewriteException.prematureEnd("Input ends after a \\ line continuation inside " + where + ".");
        }
    }

    /**
     * Copies a backslash escape that is not a line splice: the backslash and the escaped character.
     * @param out Receives the copied characters.
     * @throws IOException if the input cannot be read.
     */
    public void copyEscape(StringBuilder out) throws IOException {
        out.append(cursor.next());
        out.append(cursor.next());
    }

    /**
     * @param c The character to test.
     * @return {@code true} for horizontal whitespace, everything {@code isspace} accepts except a newline.
     */
    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == 0x0B;
    }
}
