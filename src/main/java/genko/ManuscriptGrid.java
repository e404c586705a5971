package genko;

/**
 * Rows x columns of character cells on one manuscript page.
 *
 * Settings coming from the user are validated with {@link #of(int, int)}, which clamps both
 * dimensions to [MIN, MAX]. The canonical constructor only insists on at least one cell each
 * way, so the layout engine stays total for any positive grid.
 */
public record ManuscriptGrid(int rows, int cols) {

    public static final int MIN = 8;
    public static final int MAX = 80;

    public static final ManuscriptGrid DEFAULT = new ManuscriptGrid(40, 40);

    public ManuscriptGrid {
        rows = Math.max(1, rows);
        cols = Math.max(1, cols);
    }

    /** Grid from a user setting, clamped to [MIN, MAX]. */
    public static ManuscriptGrid of(int rows, int cols) {
        return new ManuscriptGrid(CodePoints.clamp(rows, MIN, MAX), CodePoints.clamp(cols, MIN, MAX));
    }

    public int cellsPerPage() {
        return rows * cols;
    }

    @Override public String toString() {
        return rows + "x" + cols;
    }
}
