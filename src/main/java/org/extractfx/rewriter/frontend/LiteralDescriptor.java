package org.extractfx.rewriter.frontend;

import java.util.Optional;

/**
 * What the prefix of a literal says about it.
 * <p>
 * Prefix letters are read as ordinary identifier characters before the quote shows up, so
 * scanners keep the identifier they are reading in a pending buffer and classify it here once
 * a quote follows. The whole identifier must form a prefix of the shape
 * {@code [u8|u|U|L][f|x][R]}; anything else is an ordinary identifier.
 *
 * @param kind The rewrite kind.
 * @param encodingPrefix {@code u8}, {@code u}, {@code U}, {@code L} or empty.
 * @param raw Whether this is a raw literal.
 * @param terminator {@code '"'} or {@code '\''}.
 */
public record LiteralDescriptor(
        LiteralKind kind,
        String encodingPrefix,
        boolean raw,
        char terminator
) {

    /**
     * @param quote The quote character that opens the literal.
     * @return A descriptor of an unprefixed, non-raw literal.
     */
    public static LiteralDescriptor plain(char quote) {
        return new LiteralDescriptor(LiteralKind.PLAIN, "", false, quote);
    }

    /**
     * Classifies the identifier that directly precedes a quote.
     *
     * @param word The pending identifier characters, possibly empty.
     * @param quote The quote that follows them.
     * @return The descriptor, or empty if {@code word} is not a literal prefix.
     */
    public static Optional<LiteralDescriptor> fromPrefix(CharSequence word, char quote) {
        String w = word.toString();
        String encoding = "";
        if (w.startsWith("u8")) {
            encoding = "u8";
        } else if (w.startsWith("u") || w.startsWith("U") || w.startsWith("L")) {
            encoding = w.substring(0, 1);
        }
        int i = encoding.length();

        LiteralKind kind = LiteralKind.PLAIN;
        if (i < w.length() && Character.toLowerCase(w.charAt(i)) == 'f') {
            kind = LiteralKind.FORMAT;
            i++;
        } else if (i < w.length() && Character.toLowerCase(w.charAt(i)) == 'x') {
            kind = LiteralKind.EXTRACT;
            i++;
        }

        boolean raw = false;
        if (i < w.length() && w.charAt(i) == 'R') {
            raw = true;
            i++;
        }

        if (i != w.length()) {
            return Optional.empty();
        }
        // Character literals can be neither raw nor extraction literals.
        if (quote == '\'' && (raw || kind != LiteralKind.PLAIN)) {
            return Optional.empty();
        }
        return Optional.of(new LiteralDescriptor(kind, encoding, raw, quote));
    }

    /**
     * @param c The character to test.
     * @return {@code true} if {@code c} can be part of an identifier or a number.
     */
    public static boolean isWordChar(char c) {
        return c == '_' || (c != '\0' && Character.isLetterOrDigit(c));
    }

    public boolean isExtraction() {
        return kind != LiteralKind.PLAIN;
    }

    /**
     * @return The prefix written in front of the rewritten literal: encoding and {@code R}.
     */
    public String emittedPrefix() {
        return raw ? encodingPrefix + "R" : encodingPrefix;
    }
}
