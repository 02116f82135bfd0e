package org.extractfx.rewriter.frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code {expression[:format-spec]}} span of an extraction literal.
 *
 * @param start Position of the first expression character, right after the '{'.
 * @param expression The expression text exactly as written.
 * @param nestedFields Fields found in this field's format-spec, in order.
 */
public record ExtractionField(
        SourcePosition start,
        String expression,
        List<ExtractionField> nestedFields
) {

    public ExtractionField {
        nestedFields = List.copyOf(nestedFields);
    }

    /**
     * @return A copy of this field owning the given format-spec fields.
     */
    public ExtractionField withNestedFields(List<ExtractionField> fields) {
        return new ExtractionField(start, expression, fields);
    }

    /**
     * A field whose expression ends in {@code =} also prints its own text, as in {@code {value=}}.
     * @return {@code true} for such a field.
     */
    public boolean isDebugLabeled() {
        return expression.stripTrailing().endsWith("=");
    }

    /**
     * @return The text passed to the formatting call. For a labeled field the {@code =} and
     *         the blanks around it are removed.
     */
    public String argument() {
        if (!isDebugLabeled()) {
            return expression;
        }
        String trimmed = expression.stripTrailing();
        return trimmed.substring(0, trimmed.length() - 1).stripTrailing();
    }

    /**
     * Flattens this field and its format-spec fields into call-argument order.
     * @param out Receives this field, then its nested fields.
     */
    public void collectArguments(List<ExtractionField> out) {
        out.add(this);
        out.addAll(nestedFields);
    }

    /**
     * @param fields Top-level fields of one literal.
     * @return All fields in call-argument order.
     */
    public static List<ExtractionField> arguments(List<ExtractionField> fields) {
        List<ExtractionField> args = new ArrayList<>();
        for (ExtractionField field : fields) {
            field.collectArguments(args);
        }
        return args;
    }
}
