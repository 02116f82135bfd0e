package org.extractfx.rewriter;

import org.extractfx.rewriter.api.ISourceRewriter;
import org.extractfx.rewriter.api.RewriteException;
import org.extractfx.rewriter.api.RewriteOptions;
import org.extractfx.rewriter.backend.OutputAssembler;
import org.extractfx.rewriter.frontend.CommentSkipper;
import org.extractfx.rewriter.frontend.LiteralDescriptor;
import org.extractfx.rewriter.frontend.LiteralScanner;
import org.extractfx.rewriter.frontend.ScanContext;
import org.extractfx.rewriter.frontend.SourceCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * The top-level rewriting loop.
 * <p>
 * Text is copied through line by line. Comments are copied as units, literals are handed to
 * the {@link LiteralScanner}, and a {@code #} that starts a line puts the scanners into
 * directive mode until the directive's last continuation line ends.
 */
public class Rewriter implements ISourceRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(Rewriter.class);

    private final RewriteOptions options;

    public Rewriter() {
        this(RewriteOptions.defaults());
    }

    public Rewriter(RewriteOptions options) {
        this.options = options;
    }

    public RewriteOptions getOptions() {
        return options;
    }

    @Override
    public void rewrite(Reader in, Writer out) throws RewriteException, IOException {
        ScanContext context = new ScanContext(new SourceCursor(in), options);
        CommentSkipper comments = new CommentSkipper(context);
        LiteralScanner literals = new LiteralScanner(context, comments, new OutputAssembler(options));
        SourceCursor cursor = context.cursor();

        StringBuilder line = new StringBuilder();
        StringBuilder word = new StringBuilder();
        boolean lineStart = true;      // Only blanks and block comments so far on this logical line.
        boolean continued = false;     // The previous line of a directive ended in a backslash.
        char last = ' ';               // Last non-blank character of the current physical line.

        while (true) {
            char c = cursor.peek();
            if (c != SourceCursor.EOL && !cursor.atEnd()) {
                continued = false;
            }
            if (LiteralDescriptor.isWordChar(c)) {
                word.append(cursor.next());
                lineStart = false;
                last = c;
                continue;
            }
            if (c == '"' || c == '\'') {
                line.append(literals.rewriteWithPrefix(word.toString()));
                word.setLength(0);
                lineStart = false;
                last = c;
                continue;
            }
            line.append(word);
            word.setLength(0);

            if (cursor.atEnd()) {
                break;
            }
            if (c == '/' && cursor.peek(1) == '/') {
                comments.copyLine(line);
                lineStart = false;
                last = ' ';
            } else if (c == '/' && cursor.peek(1) == '*') {
                comments.copyBlock(line, true);
                last = ' ';
            } else if (c == SourceCursor.EOL) {
                line.append(cursor.next());
                out.write(line.toString());
                line.setLength(0);
                if (context.isInDirective()) {
                    continued = last == '\\';
                    context.setInDirective(continued);
                }
                lineStart = !continued;
                last = ' ';
            } else {
                if (c == '#' && lineStart) {
                    context.setInDirective(true);
                }
                if (!ScanContext.isBlank(c)) {
                    lineStart = false;
                    last = c;
                }
                line.append(cursor.next());
            }
        }

        if (context.isInDirective() && (continued || last == '\\')) {
            throw RewriteException.prematureEnd("Input ends with a line ending in \\.");
        }
        out.write(line.toString());
        out.flush();
        LOG.debug("Rewrote {} line(s) of {}", cursor.getLineNumber(), options.sourcePath().isEmpty() ? "<input>" : options.sourcePath());
    }
}
