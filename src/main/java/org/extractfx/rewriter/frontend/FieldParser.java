package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Scans the expression of one extraction field.
 * <p>
 * The scanner knows just enough C++ to find where the expression ends: brackets are matched,
 * {@code ?} at top level must be paired with a {@code :} before a {@code :} can start the
 * format-spec, literals and comments are copied as units, and {@code ::} is always scope
 * resolution.
 */
public class FieldParser {

    private final ScanContext context;
    private final CommentSkipper comments;
    private LiteralScanner literals;

    public FieldParser(ScanContext context, CommentSkipper comments) {
        this.context = context;
        this.comments = comments;
    }

    void setLiteralScanner(LiteralScanner literals) {
        this.literals = literals;
    }

    /**
     * Parses a field expression. The cursor must be right after the field's opening brace and
     * is left on the terminating {@code :} or '}', which is not consumed.
     *
     * @param raw Whether the enclosing literal is raw. Only raw literals let a field span
     *            physical lines without line splices.
     * @return The field, without format-spec fields.
     * @throws RewriteException on malformed input or premature end of input.
     * @throws IOException if the input cannot be read.
     */
    public ExtractionField parse(boolean raw) throws RewriteException, IOException {
        SourceCursor cursor = context.cursor();
        SourcePosition start = cursor.mark();
        StringBuilder expression = new StringBuilder();
        StringBuilder word = new StringBuilder();
        Deque<Character> closers = new ArrayDeque<>();
        int ternaries = 0;

        while (true) {
            char c = cursor.peek();
            if (LiteralDescriptor.isWordChar(c)) {
                word.append(cursor.next());
                continue;
            }
            if (c == '"' || c == '\'') {
                expression.append(literals.rewriteWithPrefix(word.toString()));
                word.setLength(0);
                continue;
            }
            expression.append(word);
            word.setLength(0);

            if (cursor.atEnd()) {
                throw RewriteException.prematureEnd(raw
                        ? "Input ends inside an extraction field in a raw literal."
                        : "Input ends inside an extraction field.");
            }

            switch (c) {
                case SourceCursor.EOL -> {
                    if (!raw) {
                        throw context.malformed("End of line inside extraction field.");
                    }
                    expression.append(cursor.next());
                }
                case '(', '[', '{' -> {
                    closers.push(closerOf(c));
                    expression.append(cursor.next());
                }
                case ')', ']', '}' -> {
                    if (closers.isEmpty()) {
                        if (c != '}') {
                            throw context.malformed("Unmatched '" + c + "' in extraction field.");
                        }
                        if (ternaries > 0) {
                            throw context.malformed("Extraction field ends with a '?' lacking its ':'.");
                        }
                        return new ExtractionField(start, expression.toString(), List.of());
                    }
                    if (closers.peek() != c) {
                        throw context.malformed("Mismatched '" + c + "' in extraction field, expected '" + closers.peek() + "'.");
                    }
                    closers.pop();
                    expression.append(cursor.next());
                }
                case '?' -> {
                    if (closers.isEmpty()) {
                        ternaries++;
                    }
                    expression.append(cursor.next());
                }
                case ':' -> {
                    // '::' is always scope resolution, so a format-spec cannot start with a ':' fill.
                    if (cursor.peek(1) == ':') {
                        expression.append(cursor.next()).append(cursor.next());
                    } else if (closers.isEmpty() && ternaries == 0) {
                        return new ExtractionField(start, expression.toString(), List.of());
                    } else {
                        if (closers.isEmpty()) {
                            ternaries--;
                        }
                        expression.append(cursor.next());
                    }
                }
                case '\\' -> {
                    if (raw) {
                        expression.append(cursor.next());
                    } else if (context.atLineSplice()) {
                        context.copyLineSplice(expression, "an extraction field");
                    } else {
                        context.copyEscape(expression);
                    }
                }
                case '/' -> {
                    if (cursor.peek(1) == '*') {
                        comments.copyBlock(expression, raw);
                    } else if (cursor.peek(1) == '/') {
                        comments.copyLine(expression);
                    } else {
                        expression.append(cursor.next());
                    }
                }
                default -> expression.append(cursor.next());
            }
        }
    }

    private static char closerOf(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }
}
