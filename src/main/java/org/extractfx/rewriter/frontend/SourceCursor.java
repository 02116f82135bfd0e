package org.extractfx.rewriter.frontend;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * A line-buffered character source.
 * <p>
 * The cursor holds one physical line at a time, including its terminating {@code '\n'} when
 * the input has one. When the line is used up the next one is read on demand, so callers at
 * any nesting depth see line refills transparently. Lookahead never crosses into a line that
 * is not loaded yet; it reports {@link #END} instead.
 * <p>
 * {@link #END} is also returned once the input is exhausted. It is never consumed. Since a
 * NUL character in the input reads the same, end of input is tested with {@link #atEnd()}
 * and {@link #hasChar(int)}, never by comparing against {@link #END}.
 */
public class SourceCursor {

    /** End-of-input sentinel. */
    public static final char END = '\0';
    /** End-of-line character. It is part of the line and can be consumed. */
    public static final char EOL = '\n';

    private final Reader reader;
    private final StringBuilder line = new StringBuilder();
    private int pos = 0;
    private int lineNumber = 0;
    private boolean exhausted = false;

    /**
     * Creates a cursor over the given reader. The cursor does not close the reader.
     * @param reader The input.
     */
    public SourceCursor(Reader reader) {
        this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
    }

    /**
     * @return The current character without consuming it.
     * @throws IOException if the next line cannot be read.
     */
    public char peek() throws IOException {
        return peek(0);
    }

    /**
     * Looks ahead within the current line.
     * @param offset How many characters past the current one to look.
     * @return The character, or {@link #END} if it lies beyond the loaded line.
     * @throws IOException if the next line cannot be read.
     */
    public char peek(int offset) throws IOException {
        if (pos >= line.length() && !fill()) {
            return END;
        }
        int index = pos + offset;
        return index < line.length() ? line.charAt(index) : END;
    }

    /**
     * @return {@code true} once every input character has been consumed.
     * @throws IOException if the next line cannot be read.
     */
    public boolean atEnd() throws IOException {
        return !hasChar(0);
    }

    /**
     * @param offset How many characters past the current one to look.
     * @return {@code true} if a character of the loaded line is at {@code offset}.
     * @throws IOException if the next line cannot be read.
     */
    public boolean hasChar(int offset) throws IOException {
        if (pos >= line.length() && !fill()) {
            return false;
        }
        return pos + offset < line.length();
    }

    /**
     * Consumes the current character.
     * @return The consumed character, or {@link #END} (not consumed) at end of input.
     * @throws IOException if the next line cannot be read.
     */
    public char next() throws IOException {
        if (!hasChar(0)) {
            return END;
        }
        return line.charAt(pos++);
    }

    /**
     * Checks whether the text at the cursor starts with {@code text}, without consuming it.
     * @param text The expected characters, all on the current line.
     * @return {@code true} on a full match.
     * @throws IOException if the next line cannot be read.
     */
    public boolean lookingAt(String text) throws IOException {
        for (int i = 0; i < text.length(); i++) {
            if (!hasChar(i) || peek(i) != text.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return The position of the current character. Loads the next line if needed.
     * @throws IOException if the next line cannot be read.
     */
    public SourcePosition mark() throws IOException {
        peek();
        return new SourcePosition(getLineNumber(), pos + 1);
    }

    /**
     * @return The number of the line currently loaded, at least 1.
     */
    public int getLineNumber() {
        return Math.max(1, lineNumber);
    }

    private boolean fill() throws IOException {
        if (exhausted) {
            return false;
        }
        line.setLength(0);
        pos = 0;
        int c;
        while ((c = reader.read()) != -1) {
            line.append((char) c);
            if (c == EOL) {
                break;
            }
        }
        if (c == -1) {
            exhausted = true;
        }
        if (line.length() == 0) {
            return false;
        }
        lineNumber++;
        return true;
    }
}
