package genko;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear undo history: an arena of immutable snapshots plus the index of the current one.
 * Recording while not at the end drops every later snapshot first, so there is never a branch.
 * Index 0 is the state the document was loaded with.
 */
public final class EditHistory {

    public record Snapshot(String text, int cursor, int anchor) {}

    private final List<Snapshot> entries = new ArrayList<>();
    private int index;

    public EditHistory(Snapshot initial) {
        reset(initial);
    }

    public void reset(Snapshot initial) {
        entries.clear();
        entries.add(initial);
        index = 0;
    }

    public Snapshot current() { return entries.get(index); }
    public int index() { return index; }
    public int size() { return entries.size(); }

    public boolean canUndo() { return index > 0; }
    public boolean canRedo() { return index < entries.size() - 1; }

    /**
     * Appends a snapshot after the current index. Returns false when it equals the
     * current entry, in which case nothing is recorded.
     */
    public boolean record(Snapshot snapshot) {
        if (current().equals(snapshot)) return false;
        int keep = index + 1;
        if (keep < entries.size()) {
            DebugLog.log("history", "dropping %d redo entr%s", entries.size() - keep, entries.size() - keep == 1 ? "y" : "ies");
            entries.subList(keep, entries.size()).clear();
        }
        entries.add(snapshot);
        index = entries.size() - 1;
        return true;
    }

    /** Steps back one entry; null when already at the initial state. */
    public Snapshot undo() {
        if (!canUndo()) return null;
        index = index - 1;
        return entries.get(index);
    }

    /** Steps forward one entry; null when already at the newest state. */
    public Snapshot redo() {
        if (!canRedo()) return null;
        index = index + 1;
        return entries.get(index);
    }
}
