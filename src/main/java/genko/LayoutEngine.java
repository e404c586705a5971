package genko;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * LayoutEngine
 * ------------
 * Places tokens on the manuscript grid: columns top-to-bottom, columns right-to-left,
 * pages following each other every {@code cols} global columns.
 *
 * Single forward pass with cursor (gcol, row) starting at (0, 0). Produces one Unit per
 * non-newline token and a slot for every offset in [0, length], including the interior
 * offset of a TCY pair. Pure with respect to (text, rows, cols); the live pane and the
 * exporter both call it.
 */
public final class LayoutEngine {

    /** A placed token. {@code gcol} counts columns across the whole document. */
    public static record Unit(int start, int end, String text, Tokenizer.Kind kind, int gcol, int row) {
        public int page(int cols) { return gcol / cols; }
        public int columnInPage(int cols) { return gcol % cols; }
        Unit moveTo(int newGcol, int newRow) {
            return new Unit(start, end, text, kind, newGcol, newRow);
        }
        @Override public String toString() {
            return kind + "'" + text + "'[" + start + "," + end + ")@(" + gcol + "," + row + ")";
        }
    }

    /** Grid coordinate of a cursor offset. */
    public static record Slot(int gcol, int row) {
        @Override public String toString() { return "(" + gcol + "," + row + ")"; }
    }

    public static final class Result {
        private final ManuscriptGrid grid;
        private final List<Unit> units;
        private final int[] slotCols;
        private final int[] slotRows;
        private final int maxGcol;
        private final int totalPages;

        Result(ManuscriptGrid grid, List<Unit> units, int[] slotCols, int[] slotRows, int maxGcol) {
            this.grid = grid;
            this.units = Collections.unmodifiableList(units);
            this.slotCols = slotCols;
            this.slotRows = slotRows;
            this.maxGcol = maxGcol;
            this.totalPages = Math.max(1, maxGcol / grid.cols() + 1);
        }

        public ManuscriptGrid grid() { return grid; }
        public List<Unit> units() { return units; }
        public int totalPages() { return totalPages; }
        public int maxGcol() { return maxGcol; }

        /** Always {@code length + 1}. */
        public int slotCount() { return slotCols.length; }

        /** Slot for an offset; out-of-range offsets clamp to the table. */
        public Slot slot(int offset) {
            int idx = CodePoints.clamp(offset, 0, slotCols.length - 1);
            return new Slot(slotCols[idx], slotRows[idx]);
        }

        public List<Slot> slots() {
            List<Slot> out = new ArrayList<>(slotCols.length);
            int i = 0;
            while (i < slotCols.length) {
                out.add(new Slot(slotCols[i], slotRows[i]));
                i = i + 1;
            }
            return out;
        }

        /** 1-based page / column-in-page / cell for the offset. */
        public CursorPosition positionOf(int offset) {
            Slot s = slot(offset);
            int cols = grid.cols();
            return new CursorPosition(s.gcol() / cols + 1, s.gcol() % cols + 1, s.row() + 1);
        }

        public List<Unit> unitsOnPage(int page) {
            List<Unit> out = new ArrayList<>();
            int cols = grid.cols();
            for (Unit u : units) {
                if (u.page(cols) == page) out.add(u);
            }
            return out;
        }

        /**
         * Offset whose slot is closest to the target. Distance is |dgcol| * rows + |drow|,
         * so changing column always costs more than any row change. Ties go to the lowest offset.
         */
        public int nearestOffset(int targetGcol, int targetRow) {
            int rows = grid.rows();
            int best = 0;
            long bestDist = Long.MAX_VALUE;
            int i = 0;
            int n = slotCols.length;
            while (i < n) {
                long dist = (long) Math.abs(slotCols[i] - targetGcol) * rows + Math.abs(slotRows[i] - targetRow);
                if (dist < bestDist) {
                    bestDist = dist;
                    best = i;
                }
                i = i + 1;
            }
            return best;
        }

        /** Cells a composition string occupies when drawn from the given offset. */
        public List<Unit> overlayCells(int offset, String overlay) {
            List<Unit> out = new ArrayList<>();
            if (overlay == null || overlay.isEmpty()) return out;
            Slot s = slot(offset);
            int gcol = s.gcol();
            int row = s.row();
            int[] cps = overlay.codePoints().toArray();
            int i = 0;
            while (i < cps.length) {
                out.add(new Unit(offset, offset, new String(cps, i, 1), Tokenizer.Kind.CHAR, gcol, row));
                row = row + 1;
                if (row >= grid.rows()) {
                    row = 0;
                    gcol = gcol + 1;
                }
                i = i + 1;
            }
            return out;
        }
    }

    private LayoutEngine() {}

    public static Result layout(String text, ManuscriptGrid grid) {
        int[] cps = text.codePoints().toArray();
        return layout(Tokenizer.tokenize(cps), cps.length, grid);
    }

    public static Result layout(List<Tokenizer.Token> tokens, int length, ManuscriptGrid grid) {
        long t0 = System.nanoTime();
        int rows = grid.rows();

        int[] slotCols = new int[length + 1];
        int[] slotRows = new int[length + 1];
        List<Unit> units = new ArrayList<>(tokens.size());

        int gcol = 0;
        int row = 0;
        int i = 0;
        int n = tokens.size();
        while (i < n) {
            Tokenizer.Token tok = tokens.get(i);
            i = i + 1;
            slotCols[tok.start()] = gcol;
            slotRows[tok.start()] = row;

            if (tok.kind() == Tokenizer.Kind.NEWLINE) {
                gcol = gcol + 1;
                row = 0;
                slotCols[tok.end()] = gcol;
                slotRows[tok.end()] = row;
                continue;
            }

            // an opening bracket may not sit in the last cell of a column
            if (row == rows - 1 && Kinsoku.isLineEndProhibited(tok.text())) {
                gcol = gcol + 1;
                row = 0;
            }

            // closing punctuation may not open a column: pull the previous unit down with it
            if (row == 0 && Kinsoku.isLineHeadProhibited(tok.text()) && !units.isEmpty()) {
                Unit prev = units.get(units.size() - 1);
                if (prev.gcol() == gcol - 1 && prev.row() == rows - 1) {
                    units.set(units.size() - 1, prev.moveTo(gcol, 0));
                    row = 1;
                }
            }

            int mid = tok.start() + 1;
            while (mid < tok.end()) {
                slotCols[mid] = gcol;
                slotRows[mid] = row;
                mid = mid + 1;
            }

            units.add(new Unit(tok.start(), tok.end(), tok.text(), tok.kind(), gcol, row));
            row = row + 1;
            if (row >= rows) {
                row = 0;
                gcol = gcol + 1;
            }

            slotCols[tok.end()] = gcol;
            slotRows[tok.end()] = row;
        }

        int maxGcol = 0;
        for (Unit u : units) {
            maxGcol = Math.max(maxGcol, u.gcol());
        }
        int k = 0;
        while (k < slotCols.length) {
            maxGcol = Math.max(maxGcol, slotCols[k]);
            k = k + 1;
        }

        Result result = new Result(grid, units, slotCols, slotRows, maxGcol);
        if (DebugLog.isEnabled()) {
            DebugLog.log("layout", "%s: %d tokens, %d units, %d page(s) in %d us",
                    grid, n, units.size(), result.totalPages(), (System.nanoTime() - t0) / 1000);
        }
        return result;
    }
}
