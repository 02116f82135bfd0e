package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteException;
import org.extractfx.rewriter.backend.OutputAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scans string and character literals, raw or not. For extraction literals it drives the
 * field parsers over the literal body and hands the result to the {@link OutputAssembler}.
 */
public class LiteralScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralScanner.class);
    private static final Pattern LINE_SPLICE = Pattern.compile("\\\\[ \\t\\r\\f\\x0B]*\\n");
    private static final int MAX_DELIMITER_LENGTH = 16;

    private final ScanContext context;
    private final OutputAssembler assembler;
    private final FieldParser fieldParser;
    private final FormatSpecParser formatSpecParser;

    /**
     * @param context The shared scan state.
     * @param comments Used for comments inside field expressions.
     * @param assembler Builds the output of extraction literals.
     */
    public LiteralScanner(ScanContext context, CommentSkipper comments, OutputAssembler assembler) {
        this.context = context;
        this.assembler = assembler;
        this.fieldParser = new FieldParser(context, comments);
        this.formatSpecParser = new FormatSpecParser(context, fieldParser);
        fieldParser.setLiteralScanner(this);
    }

    /**
     * Rewrites the literal at the cursor together with the identifier that precedes it.
     * <p>
     * If {@code word} is a literal prefix it is absorbed into the literal. If it is a number
     * and the cursor is on a {@code '}, the quote is a digit separator and is consumed as
     * ordinary text.
     *
     * @param word The identifier characters directly before the quote, possibly empty.
     * @return The text replacing {@code word} and the literal.
     * @throws RewriteException on malformed input or premature end of input.
     * @throws IOException if the input cannot be read.
     */
    public String rewriteWithPrefix(String word) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        char quote = cursor.peek();
        if (quote == '\'' && !word.isEmpty() && Character.isDigit(word.charAt(0))) {
            return word + cursor.next();
        }
        Optional<LiteralDescriptor> descriptor = LiteralDescriptor.fromPrefix(word, quote);
        if (descriptor.isEmpty()) {
            return word + rewrite(LiteralDescriptor.plain(quote));
        }
        return rewrite(descriptor.get());
    }

    /**
     * Scans the literal at the cursor and returns its final text: plain literals unchanged,
     * extraction literals as assembled by the {@link OutputAssembler}.
     *
     * @param descriptor The literal's prefix information.
     * @return The output text, including the prefix.
     * @throws RewriteException on malformed input or premature end of input.
     * @throws IOException if the input cannot be read.
     */
    public String rewrite(LiteralDescriptor descriptor) throws RewriteException, IOException {
        ScannedLiteral literal = scan(descriptor);
        if (!descriptor.isExtraction()) {
            return descriptor.emittedPrefix() + literal.text();
        }
        LOG.debug("Rewriting {} literal at {} with {} argument(s)",
                descriptor.kind(), literal.start(), literal.arguments().size());
        return assembler.assemble(literal, context.markersEnabled());
    }

    /**
     * Scans one literal. The cursor must be on the opening quote and is left right after the
     * closing quote.
     *
     * @param descriptor The literal's prefix information.
     * @return The scanned literal.
     * @throws RewriteException on malformed input or premature end of input.
     * @throws IOException if the input cannot be read.
     */
    public ScannedLiteral scan(LiteralDescriptor descriptor) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        SourcePosition start = cursor.mark();
        StringBuilder text = new StringBuilder();
        List<ExtractionField> fields = new ArrayList<>();

        text.append(cursor.next());
        String delimiter = descriptor.raw() ? readDelimiter(text) : "";
        String rawEnd = ")" + delimiter + descriptor.terminator();

        while (true) {
            char c = cursor.peek();
            if (descriptor.raw()) {
                if (cursor.atEnd()) {
                    throw RewriteException.prematureEnd("Input ends in raw literal.");
                }
                if (c == ')' && cursor.lookingAt(rawEnd)) {
                    for (int i = 0; i < rawEnd.length(); i++) {
                        text.append(cursor.next());
                    }
                    break;
                }
            } else {
                if (c == '\\') {
                    if (context.atLineSplice()) {
                        context.copyLineSplice(text, "a string literal");
                    } else {
                        context.copyEscape(text);
                    }
                    continue;
                }
                if (c == descriptor.terminator()) {
                    text.append(cursor.next());
                    break;
                }
                boolean atEnd = cursor.atEnd();
                if (c == SourceCursor.EOL || atEnd) {
                    // Unbalanced quotes are common in directives, as in #error don't.
                    if (context.isInDirective() && !descriptor.isExtraction()) {
                        break;
                    }
                    if (atEnd) {
                        throw RewriteException.prematureEnd("Input ends inside a string literal.");
                    }
                    throw context.malformed("Input line ends inside a string literal.");
                }
            }

            if (descriptor.isExtraction() && c == '{') {
                cursor.next();
                if (cursor.peek() == '{') {
                    cursor.next();
                    text.append('{');
                } else {
                    fields.add(scanField(descriptor, delimiter, text));
                }
            } else if (descriptor.isExtraction() && c == '}') {
                cursor.next();
                if (cursor.peek() != '}') {
                    throw context.malformed("All right braces have to be doubled in f/x string literals.");
                }
                cursor.next();
                text.append('}');
            } else {
                text.append(cursor.next());
            }
        }

        return new ScannedLiteral(descriptor, text.toString(), delimiter, fields, start, cursor.mark());
    }

    private ExtractionField scanField(LiteralDescriptor descriptor, String delimiter, StringBuilder text)
            throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        ExtractionField field = fieldParser.parse(descriptor.raw());
        if (field.isDebugLabeled()) {
            text.append(label(field.expression(), descriptor));
        }
        text.append('{');
        List<ExtractionField> nested = List.of();
        if (cursor.peek() == ':') {
            text.append(cursor.next());
            nested = formatSpecParser.parse(descriptor, delimiter, text);
        }
        text.append(cursor.next());
        return field.withNestedFields(nested);
    }

    private String readDelimiter(StringBuilder text) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        StringBuilder delimiter = new StringBuilder();
        while (cursor.peek() != '(') {
            char c = cursor.peek();
            if (cursor.atEnd()) {
                throw RewriteException.prematureEnd("Input ends in a raw literal prefix.");
            }
            if (c == SourceCursor.EOL) {
                throw context.malformed("Line ends in a raw literal prefix. There must be a ( before the end of line after R\".");
            }
            if (c == ')' || c == '\\' || ScanContext.isBlank(c)) {
                throw context.malformed("Invalid character '" + c + "' in raw literal delimiter.");
            }
            delimiter.append(cursor.next());
        }
        if (delimiter.length() > MAX_DELIMITER_LENGTH) {
            throw context.malformed("Raw literal delimiter is longer than " + MAX_DELIMITER_LENGTH + " characters.");
        }
        text.append(delimiter).append(cursor.next());
        return delimiter.toString();
    }

    // The label is written into the literal, so it must survive the literal's own lexing.
    private static String label(String expression, LiteralDescriptor descriptor) {
        if (descriptor.raw()) {
            return expression;
        }
        String joined = LINE_SPLICE.matcher(expression).replaceAll("");
        StringBuilder escaped = new StringBuilder(joined.length());
        for (char c : joined.toCharArray()) {
            if (c == '\\' || c == descriptor.terminator()) {
                escaped.append('\\').append(c);
            } else if (c == '\n') {
                escaped.append("\\n");
            } else if (c == '\r') {
                escaped.append("\\r");
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
