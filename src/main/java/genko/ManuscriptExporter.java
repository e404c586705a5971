package genko;

import java.util.ArrayList;
import java.util.List;

/**
 * Static (print/export) consumer of the layout. Lays the text out again at a fixed grid,
 * independent of whatever grid the live editor is using, and splits the units into pages.
 * Uses the same {@link LayoutEngine} as the live pane, so an exported page is cell-identical
 * to the live view at the same rows x cols. The page count covers placed units only.
 */
public final class ManuscriptExporter {

    /** Grid of the submission format: 40 rows by 40 columns per page. */
    public static final ManuscriptGrid SUBMISSION_GRID = ManuscriptGrid.DEFAULT;

    public record Page(int index, List<LayoutEngine.Unit> units) {
        public int number() { return index + 1; }
    }

    public record ExportDocument(ManuscriptGrid grid, List<Page> pages, int characterCount) {
        public int totalPages() { return pages.size(); }
    }

    private ManuscriptExporter() {}

    public static ExportDocument export(String text) {
        return export(text, SUBMISSION_GRID);
    }

    public static ExportDocument export(String text, ManuscriptGrid grid) {
        String normalized = NewlineMode.normalize(text);
        LayoutEngine.Result layout = LayoutEngine.layout(normalized, grid);

        int cols = grid.cols();
        int total = printedPages(layout, cols);
        List<List<LayoutEngine.Unit>> buckets = new ArrayList<>(total);
        int p = 0;
        while (p < total) {
            buckets.add(new ArrayList<>());
            p = p + 1;
        }
        for (LayoutEngine.Unit u : layout.units()) {
            int page = CodePoints.clamp(u.gcol() / cols, 0, total - 1);
            buckets.get(page).add(u);
        }

        List<Page> pages = new ArrayList<>(total);
        int i = 0;
        while (i < total) {
            pages.add(new Page(i, List.copyOf(buckets.get(i))));
            i = i + 1;
        }
        int chars = ManuscriptDocument.countCharacters(normalized);
        DebugLog.log("export", "%s: %d chars, %d page(s)", grid, chars, total);
        return new ExportDocument(grid, List.copyOf(pages), chars);
    }

    /**
     * Pages that carry at least one placed unit. Unlike the live view, the end-of-text slot and
     * trailing line breaks never open a blank sheet.
     */
    static int printedPages(LayoutEngine.Result layout, int cols) {
        int maxGcol = 0;
        for (LayoutEngine.Unit u : layout.units()) {
            maxGcol = Math.max(maxGcol, u.gcol());
        }
        return maxGcol / cols + 1;
    }

    /**
     * Joins several manuscripts into one buffer. A line break is inserted between two chunks
     * unless the first already ends with one or the second starts with one.
     */
    public static String combine(List<String> chunks) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = chunks.size();
        while (i < n) {
            String chunk = chunks.get(i);
            if (chunk == null) chunk = "";
            if (i > 0 && !endsWithBreak(sb) && !startsWithBreak(chunk)) {
                sb.append('\n');
            }
            sb.append(chunk);
            i = i + 1;
        }
        return sb.toString();
    }

    private static boolean endsWithBreak(StringBuilder sb) {
        if (sb.length() == 0) return false;
        char last = sb.charAt(sb.length() - 1);
        return last == '\n' || last == '\r';
    }

    private static boolean startsWithBreak(String s) {
        return !s.isEmpty() && (s.charAt(0) == '\n' || s.charAt(0) == '\r');
    }
}
