package genko;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer
 * ---------
 * Splits a manuscript buffer into an ordered, gap-free token sequence.
 * Offsets are code point offsets; tokens cover [0, length) exactly once.
 *
 * Rules, in priority order:
 *   '\n'                                  -> NEWLINE (length 1)
 *   two ASCII digits with no digit on
 *   either side                           -> TCY     (length 2)
 *   anything else                         -> CHAR    (length 1)
 *
 * A run of three or more digits is never chunked into pairs: every digit of
 * such a run becomes its own CHAR token.
 */
public final class Tokenizer {

    public enum Kind { CHAR, NEWLINE, TCY }

    public static record Token(int start, int end, String text, Kind kind) {
        public int length() { return end - start; }
        @Override public String toString() {
            return kind + "'" + text.replace("\n", "\\n") + "'[" + start + "," + end + ")";
        }
    }

    private Tokenizer() {}

    public static List<Token> tokenize(String text) {
        return tokenize(text.codePoints().toArray());
    }

    public static List<Token> tokenize(int[] cps) {
        List<Token> tokens = new ArrayList<>(cps.length);
        int n = cps.length;
        int i = 0;
        while (i < n) {
            int ch = cps[i];
            if (ch == '\n') {
                tokens.add(new Token(i, i + 1, "\n", Kind.NEWLINE));
                i = i + 1;
                continue;
            }
            if (isIsolatedDigitPair(cps, i)) {
                tokens.add(new Token(i, i + 2, new String(cps, i, 2), Kind.TCY));
                i = i + 2;
                continue;
            }
            tokens.add(new Token(i, i + 1, new String(cps, i, 1), Kind.CHAR));
            i = i + 1;
        }
        return tokens;
    }

    private static boolean isIsolatedDigitPair(int[] cps, int i) {
        int n = cps.length;
        if (i + 1 >= n) return false;
        if (!isAsciiDigit(cps[i]) || !isAsciiDigit(cps[i + 1])) return false;
        boolean clearBefore = i == 0 || !isAsciiDigit(cps[i - 1]);
        boolean clearAfter = i + 2 == n || !isAsciiDigit(cps[i + 2]);
        return clearBefore && clearAfter;
    }

    static boolean isAsciiDigit(int cp) {
        return cp >= '0' && cp <= '9';
    }
}
