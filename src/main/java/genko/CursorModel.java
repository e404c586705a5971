package genko;

/**
 * Cursor and anchor offsets into the buffer. Offsets are always kept in [0, length];
 * out-of-range requests are clamped rather than rejected.
 */
public final class CursorModel {

    public record Range(int start, int end) {
        public boolean isEmpty() { return start == end; }
        public int length() { return end - start; }
    }

    private int cursor;
    private int anchor;
    private int length;

    public int cursor() { return cursor; }
    public int anchor() { return anchor; }

    public boolean hasSelection() {
        return cursor != anchor;
    }

    public Range selectedRange() {
        return new Range(Math.min(cursor, anchor), Math.max(cursor, anchor));
    }

    /** Shrinks or grows the addressable range; both offsets are clamped into it. */
    void setLength(int length) {
        this.length = Math.max(0, length);
        this.cursor = clamp(cursor);
        this.anchor = clamp(anchor);
    }

    void set(int cursor, int anchor) {
        this.cursor = clamp(cursor);
        this.anchor = clamp(anchor);
    }

    /** Moves the cursor; the anchor follows unless {@code keepAnchor}. */
    void moveTo(int offset, boolean keepAnchor) {
        cursor = clamp(offset);
        if (!keepAnchor) anchor = cursor;
    }

    void selectAll() {
        anchor = 0;
        cursor = length;
    }

    void clearSelection() {
        anchor = cursor;
    }

    /**
     * Target offset for a visual move of (deltaCol, deltaRow) cells from the cursor's current slot.
     * The row is clamped into the column and the column floored at 0; the result is the
     * nearest slot in the layout.
     */
    int visualTarget(LayoutEngine.Result layout, int deltaCol, int deltaRow) {
        LayoutEngine.Slot here = layout.slot(cursor);
        int targetCol = Math.max(0, here.gcol() + deltaCol);
        int targetRow = CodePoints.clamp(here.row() + deltaRow, 0, layout.grid().rows() - 1);
        return layout.nearestOffset(targetCol, targetRow);
    }

    private int clamp(int offset) {
        return CodePoints.clamp(offset, 0, length);
    }
}
