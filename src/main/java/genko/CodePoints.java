package genko;

/**
 * Offset helpers for text addressed by Unicode scalar values.
 * Java strings are UTF-16; every public offset in this project counts code points.
 */
final class CodePoints {

    private CodePoints() {}

    static int length(String text) {
        return text.codePointCount(0, text.length());
    }

    /** UTF-16 index of the given code point offset, clamped to the text. */
    static int charIndex(String text, int offset) {
        int n = length(text);
        if (offset <= 0) return 0;
        if (offset >= n) return text.length();
        return text.offsetByCodePoints(0, offset);
    }

    /** Code point offset of the given UTF-16 index. */
    static int offsetOf(String text, int charIndex) {
        int idx = clamp(charIndex, 0, text.length());
        return text.codePointCount(0, idx);
    }

    static String slice(String text, int lo, int hi) {
        return text.substring(charIndex(text, lo), charIndex(text, hi));
    }

    static int clamp(int v, int lo, int hi) {
        if (v < lo) return lo;
        if (v > hi) return hi;
        return v;
    }
}
