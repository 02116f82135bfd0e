package org.extractfx.rewriter.selftest;

/**
 * One entry of the built-in self-test corpus.
 *
 * @param name A short description.
 * @param input The source text.
 * @param expected The expected output, or {@code null} if it equals the input.
 * @param ok Whether the rewrite is expected to succeed.
 */
public record SelfTestCase(String name, String input, String expected, boolean ok) {

    /**
     * @return The expected output of a successful rewrite.
     */
    public String expectedOutput() {
        return expected != null ? expected : input;
    }

    @Override
    public String toString() {
        return name;
    }
}
