package genko;

/** 1-based page, column within the page (counted from the right edge) and cell within the column. */
public record CursorPosition(int page, int column, int cell) {

    public static final CursorPosition ORIGIN = new CursorPosition(1, 1, 1);

    @Override public String toString() {
        return "Page " + page + " / Col " + column + " / Cell " + cell;
    }
}
