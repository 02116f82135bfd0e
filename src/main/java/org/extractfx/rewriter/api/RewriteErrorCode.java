package org.extractfx.rewriter.api;

/**
 * The two kinds of fatal error the rewriter can report. Both abort processing at the
 * point of detection; there is no resynchronization.
 */
public enum RewriteErrorCode {
    /** A multi-line construct (literal, field, comment, continuation) ran out of input before closing. */
    PREMATURE_END,
    /** Any other structural violation. Carries the line where it was detected. */
    MALFORMED_CONSTRUCT
}
