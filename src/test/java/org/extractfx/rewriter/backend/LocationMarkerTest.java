package org.extractfx.rewriter.backend;

import org.extractfx.rewriter.frontend.SourcePosition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LocationMarker} rendering of {@code #line} directives.
 */
@Tag("unit")
class LocationMarkerTest {

    @Test
    void render_padsToColumn() {
        assertThat(LocationMarker.render(new SourcePosition(12, 4), "x.cpp")).isEqualTo("\n#line 12 \"x.cpp\"\n   ");
        assertThat(LocationMarker.render(3, 1, "x.cpp")).isEqualTo("\n#line 3 \"x.cpp\"\n");
    }

    /**
     * Backslashes and quotes in the path are escaped, so a Windows path survives as a C++ string.
     */
    @Test
    void render_escapesPath() {
        assertThat(LocationMarker.render(1, 1, "C:\\src\\\"q\".cpp")).isEqualTo("\n#line 1 \"C:\\\\src\\\\\\\"q\\\".cpp\"\n");
    }
}
