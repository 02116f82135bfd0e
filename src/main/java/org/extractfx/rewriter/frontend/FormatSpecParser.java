package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the format-spec that follows a field's top-level colon. A '{' inside it
 * opens a nested field, which becomes an extra argument and may not have a spec of its own.
 */
public class FormatSpecParser {

    private final ScanContext context;
    private final FieldParser fields;

    public FormatSpecParser(ScanContext context, FieldParser fields) {
        this.context = context;
        this.fields = fields;
    }

    /**
     * Copies a format-spec into {@code text}. The cursor must be right after the colon and is
     * left on the closing '}', which is not consumed.
     *
     * @param literal The literal being scanned.
     * @param delimiter The raw-literal delimiter, empty for non-raw literals.
     * @param text The rewritten literal text, extended in place.
     * @return The nested fields, in order.
     * @throws RewriteException on malformed input or premature end of input.
     * @throws IOException if the input cannot be read.
     */
    public List<ExtractionField> parse(LiteralDescriptor literal, String delimiter, StringBuilder text)
            throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        List<ExtractionField> nested = new ArrayList<>();
        String rawEnd = ")" + delimiter + literal.terminator();

        while (true) {
            char c = cursor.peek();
            if (c == '}') {
                return nested;
            }
            if (cursor.atEnd()) {
                throw RewriteException.prematureEnd("Input ends inside a format-spec.");
            }
            if (c == '{') {
                text.append(cursor.next());
                ExtractionField field = fields.parse(literal.raw());
                if (cursor.peek() != '}') {
                    throw context.malformed("Found nested field ending in ':'. A nested field may not itself end in a format-spec.");
                }
                if (field.isDebugLabeled()) {
                    throw context.malformed("A nested field may not end in '='.");
                }
                nested.add(field);
                text.append(cursor.next());
                continue;
            }
            if (literal.raw()) {
                if (c == ')' && cursor.lookingAt(rawEnd)) {
                    throw context.malformed("Literal ends inside a format-spec.");
                }
            } else if (c == literal.terminator()) {
                throw context.malformed("Literal ends inside a format-spec.");
            } else if (c == SourceCursor.EOL) {
                throw context.malformed("End of line inside a format-spec.");
            } else if (c == '\\') {
                if (context.atLineSplice()) {
                    context.copyLineSplice(text, "a format-spec");
                } else {
                    context.copyEscape(text);
                }
                continue;
            }
            text.append(cursor.next());
        }
    }
}
