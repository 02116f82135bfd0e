package org.extractfx.rewriter.frontend;

import java.util.List;

/**
 * The result of scanning one literal.
 *
 * @param descriptor What the prefix said about the literal.
 * @param text The rewritten literal from opening to closing quote, prefix not included.
 * @param delimiter The raw-literal delimiter, empty for non-raw literals.
 * @param fields The top-level extraction fields, in order.
 * @param start Position of the opening quote.
 * @param end Position right after the closing quote.
 */
public record ScannedLiteral(
        LiteralDescriptor descriptor,
        String text,
        String delimiter,
        List<ExtractionField> fields,
        SourcePosition start,
        SourcePosition end
) {

    public ScannedLiteral {
        fields = List.copyOf(fields);
    }

    /**
     * @return The call arguments: every field followed by its format-spec fields.
     */
    public List<ExtractionField> arguments() {
        return ExtractionField.arguments(fields);
    }
}
