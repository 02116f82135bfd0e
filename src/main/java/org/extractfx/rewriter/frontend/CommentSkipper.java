package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteException;

import java.io.IOException;

/**
 * Copies {@code //} and {@code /* *}{@code /} comments through unchanged.
 */
public class CommentSkipper {

    private final ScanContext context;

    public CommentSkipper(ScanContext context) {
        this.context = context;
    }

    /**
     * Copies a block comment. The cursor must be at its opening {@code /*}.
     *
     * @param out Receives the comment text.
     * @param multiline If {@code false} the comment may only cross a line through a line
     *                  splice, as inside a field of a non-raw literal.
     * @throws RewriteException if the comment does not end.
     * @throws IOException if the input cannot be read.
     */
    public void copyBlock(StringBuilder out, boolean multiline) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        out.append(cursor.next()).append(cursor.next());
        while (true) {
            char c = cursor.peek();
            if (cursor.atEnd()) {
                throw RewriteException.prematureEnd("/* unmatched to the end of the input.");
            }
            if (c == '*' && cursor.peek(1) == '/') {
                out.append(cursor.next()).append(cursor.next());
                return;
            }
            if (!multiline) {
                if (c == SourceCursor.EOL) {
                    throw context.malformed("End of line inside a comment in an extraction field.");
                }
                if (c == '\\' && context.atLineSplice()) {
                    context.copyLineSplice(out, "a comment in an extraction field");
                    continue;
                }
            }
            out.append(cursor.next());
        }
    }

    /**
     * Copies a line comment up to, but not including, the end of its line. A comment whose
     * line ends in a backslash continues on the next line.
     *
     * @param out Receives the comment text.
     * @throws RewriteException if the input ends on a continued comment line.
     * @throws IOException if the input cannot be read.
     */
    public void copyLine(StringBuilder out) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        char last = ' ';
        while (true) {
            char c = cursor.peek();
            if (cursor.atEnd()) {
                if (last == '\\') {
                    throw RewriteException.prematureEnd("Input ends after a continuation line in a // comment.");
                }
                return;
            }
            if (c == SourceCursor.EOL) {
                if (last != '\\') {
                    return;
                }
                out.append(cursor.next());
                if (cursor.atEnd()) {
                    throw RewriteException.prematureEnd("Input ends after a continuation line in a // comment.");
                }
                last = ' ';
                continue;
            }
            if (!ScanContext.isBlank(c)) {
                last = c;
            }
            out.append(cursor.next());
        }
    }
}
