package genko;

/**
 * Line terminator convention of a file. The buffer itself always holds '\n' only;
 * the mode is remembered so a file can be written back the way it was read.
 */
public enum NewlineMode {
    LF("\n"), CRLF("\r\n"), CR("\r");

    private final String separator;

    NewlineMode(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    public static NewlineMode detect(String raw) {
        if (raw == null) return LF;
        if (raw.contains("\r\n")) return CRLF;
        if (raw.indexOf('\r') >= 0 && raw.indexOf('\n') < 0) return CR;
        return LF;
    }

    /** Converts CRLF and lone CR to LF. */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /** Renders normalized text with this mode's separator. */
    public String apply(String text) {
        String normalized = normalize(text);
        if (this == LF) return normalized;
        return normalized.replace("\n", separator);
    }
}
