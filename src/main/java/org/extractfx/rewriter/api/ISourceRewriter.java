package org.extractfx.rewriter.api;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Rewrites extraction literals in C++ source text into plain literals followed by their
 * extracted arguments. All other text is passed through unchanged.
 */
public interface ISourceRewriter {

    /**
     * Streams {@code in} to {@code out}, rewriting every extraction literal.
     * Text written before a failure stays written.
     *
     * @param in The source text.
     * @param out The destination of the rewritten text.
     * @throws RewriteException if the input is malformed or ends inside an open construct.
     * @throws IOException if reading or writing fails.
     */
    void rewrite(Reader in, Writer out) throws RewriteException, IOException;

    /**
     * Convenience overload for in-memory text.
     * @param source The source text.
     * @return The rewritten text.
     * @throws RewriteException if the input cannot be rewritten.
     */
    default String rewrite(String source) throws RewriteException {
        StringWriter out = new StringWriter();
        try {
            rewrite(new StringReader(source), out);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory I/O failed", e);
        }
        return out.toString();
    }
}
