package org.extractfx.rewriter.frontend;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for prefix classification in {@link LiteralDescriptor}.
 */
@Tag("unit")
class LiteralDescriptorTest {

    @Test
    void fromPrefix_recognizesFullPrefix() {
        // Act
        LiteralDescriptor descriptor = LiteralDescriptor.fromPrefix("u8fR", '"').orElseThrow();

        // Assert
        assertThat(descriptor.kind()).isEqualTo(LiteralKind.FORMAT);
        assertThat(descriptor.encodingPrefix()).isEqualTo("u8");
        assertThat(descriptor.raw()).isTrue();
        assertThat(descriptor.emittedPrefix()).isEqualTo("u8R");
    }

    @Test
    void fromPrefix_extractionLetterIsCaseInsensitive() {
        assertThat(LiteralDescriptor.fromPrefix("X", '"').orElseThrow().kind()).isEqualTo(LiteralKind.EXTRACT);
        assertThat(LiteralDescriptor.fromPrefix("LF", '"').orElseThrow().kind()).isEqualTo(LiteralKind.FORMAT);
    }

    @Test
    void fromPrefix_rawMarkerIsCaseSensitive() {
        assertThat(LiteralDescriptor.fromPrefix("fr", '"')).isEmpty();
    }

    @Test
    void fromPrefix_emptyWordIsPlainLiteral() {
        // Act
        LiteralDescriptor descriptor = LiteralDescriptor.fromPrefix("", '"').orElseThrow();

        // Assert
        assertThat(descriptor.isExtraction()).isFalse();
        assertThat(descriptor.emittedPrefix()).isEmpty();
    }

    /**
     * Identifiers that merely end in a prefix are not prefixes; the whole word has to match.
     */
    @ParameterizedTest
    @ValueSource(strings = {"af", "xf", "fx", "u8u", "Rf", "myx", "LL"})
    void fromPrefix_rejectsWordsThatAreNotPrefixes(String word) {
        assertThat(LiteralDescriptor.fromPrefix(word, '"')).isEmpty();
    }

    @Test
    void fromPrefix_characterLiteralsAreNeverExtractions() {
        assertThat(LiteralDescriptor.fromPrefix("x", '\'')).isEmpty();
        assertThat(LiteralDescriptor.fromPrefix("R", '\'')).isEmpty();
        assertThat(LiteralDescriptor.fromPrefix("u8", '\'').orElseThrow().kind()).isEqualTo(LiteralKind.PLAIN);
    }

    @Test
    void isWordChar_acceptsIdentifierCharactersOnly() {
        assertThat(LiteralDescriptor.isWordChar('_')).isTrue();
        assertThat(LiteralDescriptor.isWordChar('9')).isTrue();
        assertThat(LiteralDescriptor.isWordChar('q')).isTrue();
        assertThat(LiteralDescriptor.isWordChar(':')).isFalse();
        assertThat(LiteralDescriptor.isWordChar(SourceCursor.END)).isFalse();
    }
}
