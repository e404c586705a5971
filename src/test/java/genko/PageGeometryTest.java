package genko;

import org.junit.Test;

import java.awt.geom.Rectangle2D;

import static org.junit.Assert.assertEquals;

public class PageGeometryTest {

    private final PageGeometry geo = new PageGeometry(new ManuscriptGrid(8, 8), 20, 2);

    @Test
    public void firstPageIsRightmost() {
        assertEquals(160, geo.pageWidth());
        assertEquals(344, geo.totalWidth());
        assertEquals(172, geo.totalHeight());
        assertEquals(178.0, geo.pageOriginX(0), 0.0);
        assertEquals(6.0, geo.pageOriginX(1), 0.0);
    }

    @Test
    public void firstColumnIsRightmostInsidePage() {
        Rectangle2D r = geo.cellRect(0, 0);
        assertEquals(178 + 7 * 20, r.getX(), 0.0);
        assertEquals(6.0, r.getY(), 0.0);

        Rectangle2D next = geo.cellRect(8, 0);
        assertEquals(146.0, next.getX(), 0.0);
        assertEquals(20.0, next.getWidth(), 0.0);
    }

    @Test
    public void pointInsidePageMapsToCell() {
        assertEquals(new LayoutEngine.Slot(7, 3), geo.pointToGrid(179, 67));
        assertEquals(new LayoutEngine.Slot(7, 7), geo.pointToGrid(179, 1000));
    }

    @Test
    public void pointInGapSnapsToNearestPage() {
        // 4px right of page 1, 8px left of page 0
        assertEquals(new LayoutEngine.Slot(8, 0), geo.pointToGrid(170, -5));
        assertEquals(new LayoutEngine.Slot(0, 0), geo.pointToGrid(5000, 10));
    }

    @Test
    public void cellSizeHasFloor() {
        assertEquals(PageGeometry.MIN_CELL, new PageGeometry(ManuscriptGrid.DEFAULT, 3, 1).cellSize());
        assertEquals(PageGeometry.MIN_CELL, PageGeometry.cellSizeForFontHeight(2));
        assertEquals(28, PageGeometry.cellSizeForFontHeight(20));
    }

    @Test
    public void scrollRevealsCellWithMargin() {
        Rectangle2D cell = geo.cellRect(8, 0);

        PageGeometry.ScrollPosition right = PageGeometry.scrollToReveal(
                new PageGeometry.Viewport(0, 0, 100, 100, 244, 72), cell);
        assertEquals(new PageGeometry.ScrollPosition(78, 0), right);

        PageGeometry.ScrollPosition left = PageGeometry.scrollToReveal(
                new PageGeometry.Viewport(200, 0, 100, 100, 244, 72), cell);
        assertEquals(new PageGeometry.ScrollPosition(138, 0), left);
    }

    @Test
    public void visibleCellLeavesScrollUnchanged() {
        Rectangle2D cell = geo.cellRect(8, 0);
        PageGeometry.ScrollPosition same = PageGeometry.scrollToReveal(
                new PageGeometry.Viewport(100, 0, 100, 100, 244, 72), cell);
        assertEquals(new PageGeometry.ScrollPosition(100, 0), same);
    }
}
