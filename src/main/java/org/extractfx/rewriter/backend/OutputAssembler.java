package org.extractfx.rewriter.backend;

import org.extractfx.rewriter.api.RewriteOptions;
import org.extractfx.rewriter.frontend.ExtractionField;
import org.extractfx.rewriter.frontend.LiteralDescriptor;
import org.extractfx.rewriter.frontend.LiteralKind;
import org.extractfx.rewriter.frontend.ScannedLiteral;

import java.util.List;

/**
 * Builds the output for a scanned extraction literal.
 * <ul>
 *   <li>{@code x} literals become {@code <literal>, arg1, arg2, ...}.</li>
 *   <li>{@code f} literals become {@code name(<literal>, arg1, arg2, ...)}.</li>
 * </ul>
 */
public class OutputAssembler {

    /** A function name ending in this character gets the argument count appended instead. */
    public static final char ARGUMENT_COUNT_PLACEHOLDER = '*';

    private final RewriteOptions options;

    public OutputAssembler(RewriteOptions options) {
        this.options = options;
    }

    /**
     * @param literal The scanned extraction literal.
     * @param withMarkers Whether to surround the parts with location markers.
     * @return The replacement text for the literal and its prefix.
     */
    public String assemble(ScannedLiteral literal, boolean withMarkers) {
        LiteralDescriptor descriptor = literal.descriptor();
        List<ExtractionField> arguments = literal.arguments();
        String path = options.sourcePath();
        StringBuilder out = new StringBuilder();

        if (descriptor.kind() == LiteralKind.FORMAT) {
            out.append(functionName(arguments.size())).append('(');
        }
        String prefix = descriptor.emittedPrefix();
        if (withMarkers) {
            out.append(LocationMarker.render(literal.start().line(), literal.start().column() - prefix.length(), path));
        }
        out.append(prefix).append(literal.text());

        for (ExtractionField argument : arguments) {
            out.append(", ");
            if (withMarkers) {
                out.append(LocationMarker.render(argument.start(), path));
            }
            out.append(argument.argument());
        }

        if (descriptor.kind() == LiteralKind.FORMAT) {
            out.append(')');
        }
        if (withMarkers) {
            out.append(LocationMarker.render(literal.end(), path));
        }
        return out.toString();
    }

    /**
     * @param argumentCount The number of extracted arguments.
     * @return The configured function name with a trailing placeholder replaced by the count.
     */
    public String functionName(int argumentCount) {
        String name = options.functionName();
        if (name.charAt(name.length() - 1) == ARGUMENT_COUNT_PLACEHOLDER) {
            return name.substring(0, name.length() - 1) + argumentCount;
        }
        return name;
    }
}
