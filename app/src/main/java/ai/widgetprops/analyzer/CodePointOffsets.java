package ai.widgetprops.analyzer;

/**
 * Converts the code point indexes reported by the generated lexer into {@code String} char offsets. The two differ
 * only after a supplementary character, which takes two chars.
 */
final class CodePointOffsets {
    private final String text;
    private final boolean identity;

    CodePointOffsets(String text) {
        this.text = text;
        this.identity = text.codePointCount(0, text.length()) == text.length();
    }

    /** Clamps to {@code [0, text.length()]}. */
    int charOffset(int codePointIndex) {
        if (codePointIndex <= 0) return 0;
        if (identity) return Math.min(codePointIndex, text.length());
        if (codePointIndex >= text.codePointCount(0, text.length())) return text.length();
        return text.offsetByCodePoints(0, codePointIndex);
    }
}
