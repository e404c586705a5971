package genko;

import org.junit.Test;

import static genko.EditHistory.Snapshot;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EditHistoryTest {

    @Test
    public void identicalSnapshotIsNotRecorded() {
        EditHistory h = new EditHistory(new Snapshot("a", 1, 1));
        assertFalse(h.record(new Snapshot("a", 1, 1)));
        assertTrue(h.record(new Snapshot("a", 0, 0)));
        assertEquals(2, h.size());
    }

    @Test
    public void undoAndRedoStopAtEnds() {
        EditHistory h = new EditHistory(new Snapshot("", 0, 0));
        assertNull(h.undo());
        h.record(new Snapshot("a", 1, 1));
        assertNull(h.redo());
        assertEquals(new Snapshot("", 0, 0), h.undo());
        assertEquals(new Snapshot("a", 1, 1), h.redo());
    }

    @Test
    public void recordingAfterUndoDropsRedoEntries() {
        EditHistory h = new EditHistory(new Snapshot("", 0, 0));
        h.record(new Snapshot("a", 1, 1));
        h.record(new Snapshot("ab", 2, 2));
        h.undo();
        h.undo();
        h.record(new Snapshot("x", 1, 1));
        assertEquals(2, h.size());
        assertEquals(1, h.index());
        assertFalse(h.canRedo());
    }

    @Test
    public void resetStartsOver() {
        EditHistory h = new EditHistory(new Snapshot("", 0, 0));
        h.record(new Snapshot("a", 1, 1));
        h.reset(new Snapshot("z", 0, 0));
        assertEquals(1, h.size());
        assertEquals(new Snapshot("z", 0, 0), h.current());
        assertFalse(h.canUndo());
    }
}
