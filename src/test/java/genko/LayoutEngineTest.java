package genko;

import org.junit.Test;

import java.util.List;

import static genko.LayoutEngine.Slot;
import static genko.LayoutEngine.Unit;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LayoutEngineTest {

    private static Slot s(int gcol, int row) {
        return new Slot(gcol, row);
    }

    @Test
    public void newlineAdvancesToNextColumn() {
        LayoutEngine.Result r = LayoutEngine.layout("A\nB", new ManuscriptGrid(3, 3));

        assertEquals(2, r.units().size());
        Unit a = r.units().get(0);
        Unit b = r.units().get(1);
        assertEquals("A", a.text());
        assertEquals(0, a.gcol());
        assertEquals(0, a.row());
        assertEquals("B", b.text());
        assertEquals(1, b.gcol());
        assertEquals(0, b.row());

        // the newline's start slot is the cell after 'A'; its end slot opens the next column
        assertEquals(List.of(s(0, 0), s(0, 1), s(1, 0), s(1, 1)), r.slots());
        assertEquals(1, r.totalPages());
    }

    @Test
    public void emptyBufferHasOneSlotAndOnePage() {
        LayoutEngine.Result r = LayoutEngine.layout("", ManuscriptGrid.DEFAULT);
        assertTrue(r.units().isEmpty());
        assertEquals(1, r.slotCount());
        assertEquals(s(0, 0), r.slot(0));
        assertEquals(1, r.totalPages());
    }

    @Test
    public void columnWrapsAfterLastRow() {
        LayoutEngine.Result r = LayoutEngine.layout("あいうえお", new ManuscriptGrid(4, 8));
        assertEquals(3, r.units().get(3).row());
        assertEquals(0, r.units().get(3).gcol());
        assertEquals(1, r.units().get(4).gcol());
        assertEquals(0, r.units().get(4).row());
        assertEquals(s(1, 1), r.slot(5));
    }

    @Test
    public void openingBracketIsNotLeftInLastCell() {
        LayoutEngine.Result r = LayoutEngine.layout("あいう「え", new ManuscriptGrid(4, 8));
        Unit bracket = r.units().get(3);
        assertEquals("「", bracket.text());
        assertEquals(1, bracket.gcol());
        assertEquals(0, bracket.row());
        Unit next = r.units().get(4);
        assertEquals(1, next.gcol());
        assertEquals(1, next.row());
        // the start slot of the bracket was recorded before the forced wrap
        assertEquals(s(0, 3), r.slot(3));
        assertEquals(s(1, 1), r.slot(4));
    }

    @Test
    public void closingPunctuationPullsPreviousUnitIntoNewColumn() {
        LayoutEngine.Result r = LayoutEngine.layout("あいうえ。", new ManuscriptGrid(4, 8));
        Unit e = r.units().get(3);
        Unit stop = r.units().get(4);
        assertEquals("え", e.text());
        assertEquals(1, e.gcol());
        assertEquals(0, e.row());
        assertEquals("。", stop.text());
        assertEquals(1, stop.gcol());
        assertEquals(1, stop.row());
        assertEquals(s(1, 2), r.slot(5));
        // slots already recorded for the pulled unit are left where they were
        assertEquals(s(0, 3), r.slot(3));
    }

    @Test
    public void pullBackOnlyWhenPreviousUnitEndsTheColumn() {
        LayoutEngine.Result afterBreak = LayoutEngine.layout("あ\n。", new ManuscriptGrid(4, 8));
        assertEquals(0, afterBreak.units().get(0).gcol());
        assertEquals(0, afterBreak.units().get(0).row());
        assertEquals(1, afterBreak.units().get(1).gcol());
        assertEquals(0, afterBreak.units().get(1).row());

        LayoutEngine.Result first = LayoutEngine.layout("。", new ManuscriptGrid(4, 8));
        assertEquals(0, first.units().get(0).row());
    }

    @Test
    public void tcyOccupiesOneCellAndSharesInteriorSlot() {
        LayoutEngine.Result r = LayoutEngine.layout("a12", new ManuscriptGrid(8, 8));
        assertEquals(2, r.units().size());
        Unit tcy = r.units().get(1);
        assertEquals(Tokenizer.Kind.TCY, tcy.kind());
        assertEquals(1, tcy.row());
        assertEquals(s(0, 1), r.slot(1));
        assertEquals(s(0, 1), r.slot(2));
        assertEquals(s(0, 2), r.slot(3));
    }

    @Test
    public void fullPageEndSlotOpensNextPage() {
        LayoutEngine.Result r = LayoutEngine.layout("あ".repeat(64), new ManuscriptGrid(8, 8));
        assertEquals(7, r.units().get(63).gcol());
        assertEquals(s(8, 0), r.slot(64));
        assertEquals(2, r.totalPages());
        assertEquals(64, r.unitsOnPage(0).size());
        assertTrue(r.unitsOnPage(1).isEmpty());
    }

    @Test
    public void trailingNewlinesCountTowardPages() {
        LayoutEngine.Result r = LayoutEngine.layout("\n".repeat(8), new ManuscriptGrid(8, 8));
        assertEquals(8, r.maxGcol());
        assertEquals(2, r.totalPages());
    }

    @Test
    public void positionIsOneBasedPageColumnCell() {
        LayoutEngine.Result r = LayoutEngine.layout("あ".repeat(70), new ManuscriptGrid(8, 8));
        assertEquals(new CursorPosition(1, 1, 1), r.positionOf(0));
        assertEquals(new CursorPosition(2, 1, 7), r.positionOf(70));
    }

    @Test
    public void nearestOffsetWeighsColumnsOverRowsAndPrefersLowestOffset() {
        LayoutEngine.Result r = LayoutEngine.layout("A\nB", new ManuscriptGrid(8, 8));
        assertEquals(2, r.nearestOffset(1, 0));
        assertEquals(1, r.nearestOffset(0, 5));
        assertEquals(3, r.nearestOffset(1, 7));

        LayoutEngine.Result tcy = LayoutEngine.layout("12", new ManuscriptGrid(8, 8));
        assertEquals(0, tcy.nearestOffset(0, 0));
    }

    @Test
    public void slotLookupClampsOutOfRangeOffsets() {
        LayoutEngine.Result r = LayoutEngine.layout("AB", new ManuscriptGrid(8, 8));
        assertEquals(r.slot(0), r.slot(-5));
        assertEquals(r.slot(2), r.slot(99));
    }

    @Test
    public void layoutIsPure() {
        String text = "「今日は12月、晴れ。」\n123と45。\n\n" + "あ".repeat(100);
        ManuscriptGrid grid = new ManuscriptGrid(8, 10);
        LayoutEngine.Result a = LayoutEngine.layout(text, grid);
        LayoutEngine.Result b = LayoutEngine.layout(text, grid);
        assertEquals(a.units(), b.units());
        assertEquals(a.slots(), b.slots());
        assertEquals(a.totalPages(), b.totalPages());
    }

    @Test
    public void slotTableAndRowsStayInBoundsAcrossCorpus() {
        String[] corpus = {
                "", "\n", "12", "123", "「", "。", "あいう「え", "あいうえ。",
                "「「「「「「「「「", "。。。。。。。。。", "ああああ」」」」", "𠮷𠮷12\r\n」",
                "吾輩は猫である。名前はまだ無い。\nどこで生れたかとんと見当がつかぬ。",
                "x".repeat(300) + "\n\n" + "(" + "12".repeat(5)
        };
        int[][] grids = {{4, 4}, {4, 8}, {8, 8}, {40, 40}, {80, 8}};
        for (String text : corpus) {
            for (int[] g : grids) {
                ManuscriptGrid grid = new ManuscriptGrid(g[0], g[1]);
                LayoutEngine.Result r = LayoutEngine.layout(text, grid);
                assertEquals(CodePoints.length(text) + 1, r.slotCount());
                for (Unit u : r.units()) {
                    assertTrue(u.gcol() >= 0);
                    assertTrue(u.row() >= 0 && u.row() < grid.rows());
                }
                for (Slot sl : r.slots()) {
                    assertTrue(sl.gcol() >= 0);
                    assertTrue(sl.row() >= 0 && sl.row() < grid.rows());
                }
                assertTrue(r.totalPages() >= 1);
            }
        }
    }

    @Test
    public void overlayCellsWrapAtColumnEnd() {
        LayoutEngine.Result r = LayoutEngine.layout("あいう", new ManuscriptGrid(4, 8));
        List<Unit> cells = r.overlayCells(3, "かな");
        assertEquals(2, cells.size());
        assertEquals(0, cells.get(0).gcol());
        assertEquals(3, cells.get(0).row());
        assertEquals(1, cells.get(1).gcol());
        assertEquals(0, cells.get(1).row());
    }
}
