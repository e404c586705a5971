package genko;

import java.util.regex.PatternSyntaxException;

/**
 * Raised by a regex search whose pattern does not compile. Distinct from "no match",
 * which is reported as a plain {@code false}.
 */
public class InvalidPatternException extends Exception {

    private final String pattern;
    private final int errorIndex;

    public InvalidPatternException(PatternSyntaxException cause) {
        super("Invalid pattern: " + cause.getDescription(), cause);
        this.pattern = cause.getPattern();
        this.errorIndex = cause.getIndex();
    }

    public String pattern() {
        return pattern;
    }

    /** Index of the offending character in the pattern, or -1 if unknown. */
    public int errorIndex() {
        return errorIndex;
    }
}
