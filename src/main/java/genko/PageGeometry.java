package genko;

import java.awt.geom.Rectangle2D;

/**
 * Pixel geometry of the page strip. Page 0 sits at the right end of the strip and later pages
 * continue to the left; inside a page, column 0 is the rightmost column.
 * Coordinates are world coordinates, i.e. relative to the scrolled content origin.
 */
public record PageGeometry(ManuscriptGrid grid, int cellSize, int totalPages) {

    public static final int PAGE_GAP = 12;
    public static final int OUTER_MARGIN = 6;
    public static final int MIN_CELL = 16;

    /** Visible part of the content plus the largest scroll offsets. */
    public record Viewport(int x, int y, int width, int height, int maxX, int maxY) {}

    /** New scroll offsets. */
    public record ScrollPosition(int x, int y) {}

    public PageGeometry {
        cellSize = Math.max(MIN_CELL, cellSize);
        totalPages = Math.max(1, totalPages);
    }

    public static int cellSizeForFontHeight(int fontHeight) {
        return Math.max(MIN_CELL, fontHeight + 8);
    }

    public int pageWidth() { return grid.cols() * cellSize; }
    public int pageHeight() { return grid.rows() * cellSize; }

    public int totalWidth() {
        return OUTER_MARGIN * 2 + totalPages * pageWidth() + Math.max(0, totalPages - 1) * PAGE_GAP;
    }

    public int totalHeight() {
        return OUTER_MARGIN * 2 + pageHeight();
    }

    public double pageOriginX(int page) {
        return OUTER_MARGIN + (double) (totalPages - 1 - page) * (pageWidth() + PAGE_GAP);
    }

    public Rectangle2D.Double pageRect(int page) {
        return new Rectangle2D.Double(pageOriginX(page), OUTER_MARGIN, pageWidth(), pageHeight());
    }

    public Rectangle2D.Double cellRect(int gcol, int row) {
        int cols = grid.cols();
        int page = gcol / cols;
        int colInPage = gcol % cols;
        double x = pageOriginX(page) + (double) (cols - 1 - colInPage) * cellSize;
        double y = OUTER_MARGIN + (double) row * cellSize;
        return new Rectangle2D.Double(x, y, cellSize, cellSize);
    }

    /**
     * Grid cell under a world point. The page is the one horizontally nearest to the point
     * (distance 0 inside it); column and row are clamped into that page.
     */
    public LayoutEngine.Slot pointToGrid(double worldX, double worldY) {
        int pageW = pageWidth();
        int pageH = pageHeight();
        int cols = grid.cols();

        double localY = worldY - OUTER_MARGIN;
        int row = localY >= 0 ? (int) (Math.min(pageH - 1, localY) / cellSize) : 0;

        int bestPage = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        int page = 0;
        while (page < totalPages) {
            double left = pageOriginX(page);
            double right = left + pageW;
            double dist;
            if (worldX < left) {
                dist = left - worldX;
            } else if (worldX > right) {
                dist = worldX - right;
            } else {
                dist = 0.0;
            }
            if (dist < bestDist) {
                bestDist = dist;
                bestPage = page;
            }
            page = page + 1;
        }

        double withinX = Math.max(0.0, Math.min(pageW - 1, worldX - pageOriginX(bestPage)));
        int colFromLeft = (int) (withinX / cellSize);
        int colInPage = CodePoints.clamp(cols - 1 - colFromLeft, 0, cols - 1);
        return new LayoutEngine.Slot(bestPage * cols + colInPage, row);
    }

    /** Scroll offsets that bring {@code cell} into the viewport with a small margin. */
    public static ScrollPosition scrollToReveal(Viewport vp, Rectangle2D cell) {
        int x = vp.x();
        if (cell.getMinX() < vp.x() + 4) {
            x = Math.max(0, (int) cell.getMinX() - 8);
        } else if (cell.getMaxX() > vp.x() + vp.width() - 4) {
            x = Math.min(vp.maxX(), (int) (cell.getMaxX() - vp.width() + 12));
        }

        int y = vp.y();
        if (cell.getMinY() < vp.y() + 4) {
            y = Math.max(0, (int) cell.getMinY() - 8);
        } else if (cell.getMaxY() > vp.y() + vp.height() - 4) {
            y = Math.min(vp.maxY(), (int) (cell.getMaxY() - vp.height() + 12));
        }
        return new ScrollPosition(x, y);
    }
}
