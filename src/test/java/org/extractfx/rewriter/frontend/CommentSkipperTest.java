package org.extractfx.rewriter.frontend;

import org.extractfx.rewriter.api.RewriteErrorCode;
import org.extractfx.rewriter.api.RewriteException;
import org.extractfx.rewriter.api.RewriteOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link CommentSkipper}.
 * These tests verify that block and line comments are copied verbatim, including their line
 * splices, and that unterminated comments are reported.
 */
@Tag("unit")
class CommentSkipperTest {

    private static ScanContext contextOf(String source) {
        return new ScanContext(new SourceCursor(new StringReader(source)), RewriteOptions.defaults());
    }

    @Test
    void copyBlock_copiesAcrossLinesWhenMultiline() throws Exception {
        // Arrange
        ScanContext context = contextOf("/* a\n \" b */rest");
        StringBuilder out = new StringBuilder();

        // Act
        new CommentSkipper(context).copyBlock(out, true);

        // Assert
        assertThat(out.toString()).isEqualTo("/* a\n \" b */");
        assertThat(context.cursor().peek()).isEqualTo('r');
    }

    /**
     * Inside a non-raw extraction field a block comment must stay on one logical line.
     */
    @Test
    void copyBlock_rejectsLineBreakInSingleLineMode() {
        // Arrange
        ScanContext context = contextOf("/* a\n b */");

        // Act & Assert
        assertThatThrownBy(() -> new CommentSkipper(context).copyBlock(new StringBuilder(), false))
                .isInstanceOf(RewriteException.class)
                .extracting(e -> ((RewriteException) e).getCode())
                .isEqualTo(RewriteErrorCode.MALFORMED_CONSTRUCT);
    }

    @Test
    void copyBlock_followsLineSpliceInSingleLineMode() throws Exception {
        // Arrange
        ScanContext context = contextOf("/* a\\\n b */}");
        StringBuilder out = new StringBuilder();

        // Act
        new CommentSkipper(context).copyBlock(out, false);

        // Assert
        assertThat(out.toString()).isEqualTo("/* a\\\n b */");
    }

    @Test
    void copyBlock_unterminatedIsPrematureEnd() {
        // Arrange
        ScanContext context = contextOf("/* never closed");

        // Act & Assert
        assertThatThrownBy(() -> new CommentSkipper(context).copyBlock(new StringBuilder(), true))
                .isInstanceOf(RewriteException.class)
                .extracting(e -> ((RewriteException) e).getCode())
                .isEqualTo(RewriteErrorCode.PREMATURE_END);
    }

    @Test
    void copyLine_stopsBeforeEndOfLine() throws Exception {
        // Arrange
        ScanContext context = contextOf("// note \"\nnext");
        StringBuilder out = new StringBuilder();

        // Act
        new CommentSkipper(context).copyLine(out);

        // Assert
        assertThat(out.toString()).isEqualTo("// note \"");
        assertThat(context.cursor().peek()).isEqualTo(SourceCursor.EOL);
    }

    /**
     * Verifies that a line comment whose last non-blank character is a backslash continues on the
     * next line, as C++ line splicing does.
     */
    @Test
    void copyLine_continuesAfterTrailingBackslash() throws Exception {
        // Arrange
        ScanContext context = contextOf("// a \\ \nb\nc");
        StringBuilder out = new StringBuilder();

        // Act
        new CommentSkipper(context).copyLine(out);

        // Assert
        assertThat(out.toString()).isEqualTo("// a \\ \nb");
    }

    @Test
    void copyLine_inputEndingOnContinuationIsPrematureEnd() {
        // Arrange
        ScanContext context = contextOf("// a \\");

        // Act & Assert
        assertThatThrownBy(() -> new CommentSkipper(context).copyLine(new StringBuilder()))
                .isInstanceOf(RewriteException.class)
                .extracting(e -> ((RewriteException) e).getCode())
                .isEqualTo(RewriteErrorCode.PREMATURE_END);
    }

    @Test
    void copyLine_copiesToEndOfInput() throws IOException, RewriteException {
        // Arrange
        ScanContext context = contextOf("// last");
        StringBuilder out = new StringBuilder();

        // Act
        new CommentSkipper(context).copyLine(out);

        // Assert
        assertThat(out.toString()).isEqualTo("// last");
    }
}
