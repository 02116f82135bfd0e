package org.extractfx.rewriter.api;

/**
 * Thrown when the rewriter meets input it cannot process.
 * <p>
 * The message of a {@link RewriteErrorCode#MALFORMED_CONSTRUCT} error is prefixed with the
 * offending line, {@code "Line <N>: <message>"}. Premature end of input is reported without
 * a line number.
 */
public class RewriteException extends Exception {

    private final RewriteErrorCode code;
    private final int lineNumber;

    private RewriteException(RewriteErrorCode code, int lineNumber, String message) {
        super(message);
        this.code = code;
        this.lineNumber = lineNumber;
    }

    /**
     * Creates an error for input that ended inside an unfinished construct.
     * @param message What was left open.
     * @return The exception to throw.
     */
    public static RewriteException prematureEnd(String message) {
        return new RewriteException(RewriteErrorCode.PREMATURE_END, 0, message);
    }

    /**
     * Creates an error for a malformed construct.
     * @param lineNumber The 1-based line where the violation was detected.
     * @param message The description of the violation.
     * @return The exception to throw.
     */
    public static RewriteException malformed(int lineNumber, String message) {
        return new RewriteException(RewriteErrorCode.MALFORMED_CONSTRUCT, lineNumber,
                String.format("Line %d: %s", lineNumber, message));
    }

    public RewriteErrorCode getCode() {
        return code;
    }

    /**
     * @return The line of a malformed construct, or 0 for premature end of input.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
