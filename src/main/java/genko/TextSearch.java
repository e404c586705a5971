package genko;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Literal or regex search over the buffer, in either direction, wrapping around once.
 *
 * Forward starts at the selection's upper edge and, failing that, searches [0, start).
 * Backward takes the last match inside [0, start) and, failing that, the last match at or
 * after start. Offsets in and out are code point offsets.
 */
public final class TextSearch {

    public record Match(int start, int end) {}

    private TextSearch() {}

    /**
     * @param selLo lower edge of the current selection
     * @param selHi upper edge of the current selection
     * @return the match, or null when the pattern is empty or does not occur
     * @throws InvalidPatternException if {@code isRegex} and the pattern does not compile
     */
    public static Match find(String text, String pattern, int selLo, int selHi,
                             boolean forward, boolean isRegex, boolean caseSensitive) throws InvalidPatternException {
        if (pattern == null || pattern.isEmpty()) return null;

        Pattern regex = null;
        if (isRegex) {
            regex = compile(pattern, caseSensitive);
        }
        if (text.isEmpty()) return null;

        int startOffset = forward ? Math.max(selLo, selHi) : Math.min(selLo, selHi);
        int start = CodePoints.charIndex(text, startOffset);

        int[] span = isRegex
                ? findRegex(text, regex, start, forward)
                : findLiteral(text, pattern, start, forward, caseSensitive);
        if (span == null) return null;
        return new Match(CodePoints.offsetOf(text, span[0]), CodePoints.offsetOf(text, span[1]));
    }

    static Pattern compile(String pattern, boolean caseSensitive) throws InvalidPatternException {
        int flags = Pattern.MULTILINE;
        if (!caseSensitive) {
            flags = flags | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        try {
            return Pattern.compile(pattern, flags);
        } catch (PatternSyntaxException ex) {
            DebugLog.log("search", "rejected pattern /%s/ (%s)", pattern, ex.getDescription());
            throw new InvalidPatternException(ex);
        }
    }

    private static int[] findRegex(String text, Pattern regex, int start, boolean forward) {
        Matcher m = regex.matcher(text);
        if (forward) {
            if (m.find(start)) return new int[]{m.start(), m.end()};
            // wrapped part behaves as if the text ended at start
            m.reset();
            m.region(0, start);
            if (m.find()) return new int[]{m.start(), m.end()};
            return null;
        }

        m.region(0, start);
        int[] last = lastMatch(m);
        if (last != null) return last;

        m.reset();
        m.region(start, text.length());
        m.useTransparentBounds(true);
        m.useAnchoringBounds(false);
        return lastMatch(m);
    }

    private static int[] lastMatch(Matcher m) {
        int[] last = null;
        while (m.find()) {
            last = new int[]{m.start(), m.end()};
        }
        return last;
    }

    private static int[] findLiteral(String text, String needle, int start, boolean forward, boolean caseSensitive) {
        boolean ignoreCase = !caseSensitive;
        int n = needle.length();
        int len = text.length();
        if (forward) {
            int i = start;
            while (i + n <= len) {
                if (text.regionMatches(ignoreCase, i, needle, 0, n)) return new int[]{i, i + n};
                i = i + 1;
            }
            i = 0;
            while (i + n <= start) {
                if (text.regionMatches(ignoreCase, i, needle, 0, n)) return new int[]{i, i + n};
                i = i + 1;
            }
            return null;
        }

        int i = start - n;
        while (i >= 0) {
            if (text.regionMatches(ignoreCase, i, needle, 0, n)) return new int[]{i, i + n};
            i = i - 1;
        }
        i = len - n;
        while (i >= start) {
            if (text.regionMatches(ignoreCase, i, needle, 0, n)) return new int[]{i, i + n};
            i = i - 1;
        }
        return null;
    }
}
