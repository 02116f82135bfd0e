package org.extractfx.rewriter.frontend;

/**
 * How a literal is rewritten.
 */
public enum LiteralKind {
    /** An ordinary literal. Copied through unchanged. */
    PLAIN,
    /** {@code f"..."}: becomes a call of the configured function. */
    FORMAT,
    /** {@code x"..."}: becomes the literal followed by its arguments. */
    EXTRACT
}
