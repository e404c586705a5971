package genko;

import java.io.PrintStream;

/**
 * Opt-in trace output, tagged by area ("layout", "history", "search", "export", "workbook", "clipboard").
 * Off unless {@code -Dgenko.debug=true} is given or {@link #setEnabled(boolean)} is called.
 * Lines look like {@code [genko:layout] 40x40: 12 tokens, ...}.
 */
public final class DebugLog {
    private static volatile boolean enabled = Boolean.getBoolean("genko.debug");
    private static volatile PrintStream sink = System.out;

    private DebugLog() {}

    public static void setEnabled(boolean on) {
        enabled = on;
    }

    public static boolean isEnabled() {
        return enabled;
    }

    /** Redirects output; null restores stdout. */
    static void setSink(PrintStream stream) {
        sink = stream == null ? System.out : stream;
    }

    public static void log(String area, String fmt, Object... args) {
        if (!enabled) return;
        String msg = args.length == 0 ? fmt : String.format(fmt, args);
        sink.println("[genko:" + area + "] " + msg);
    }
}
