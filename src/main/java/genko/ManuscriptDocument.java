package genko;

import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;

/**
 * One open manuscript: the text buffer, its selection, undo history and the layout derived from them.
 *
 * Every mutation re-tokenizes and re-lays-out the whole buffer; the layout is never patched.
 * Offsets are code point offsets and are clamped, never rejected. Not thread-safe: a single
 * caller (the Swing EDT for the live pane) finishes one operation before starting the next.
 */
public class ManuscriptDocument {

    private String text = "";
    private int length;
    private String lastSaved = "";
    private boolean dirty;
    private boolean readOnly;
    private String preedit = "";

    private ManuscriptGrid grid = ManuscriptGrid.DEFAULT;
    private int cellSize = 36;
    private LayoutEngine.Result layout;
    private PageGeometry geometry;

    private final CursorModel selection = new CursorModel();
    private final EditHistory history = new EditHistory(new EditHistory.Snapshot("", 0, 0));
    private final List<ManuscriptListener> listeners = new ArrayList<>();

    public ManuscriptDocument() {
        rebuildLayout();
    }

    public ManuscriptDocument(String text) {
        this();
        setPlainText(text);
    }

    // ---- Listeners ----

    public void addListener(ManuscriptListener l) {
        if (l != null) listeners.add(l);
    }

    public void removeListener(ManuscriptListener l) {
        listeners.remove(l);
    }

    // ---- Accessors ----

    public String text() { return text; }
    public int length() { return length; }
    public boolean isDirty() { return dirty; }
    public String lastSaved() { return lastSaved; }
    public boolean isReadOnly() { return readOnly; }
    public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }

    public ManuscriptGrid grid() { return grid; }
    public int cellSize() { return cellSize; }
    public LayoutEngine.Result layout() { return layout; }
    public PageGeometry geometry() { return geometry; }

    public int cursor() { return selection.cursor(); }
    public int anchor() { return selection.anchor(); }
    public boolean hasSelection() { return selection.hasSelection(); }
    public CursorModel.Range selectedRange() { return selection.selectedRange(); }

    public String selectedText() {
        CursorModel.Range r = selection.selectedRange();
        if (r.isEmpty()) return "";
        return CodePoints.slice(text, r.start(), r.end());
    }

    public EditHistory history() { return history; }
    public boolean canUndo() { return history.canUndo(); }
    public boolean canRedo() { return history.canRedo(); }

    /** Characters excluding line breaks. */
    public int characterCount() {
        return countCharacters(text);
    }

    static int countCharacters(String s) {
        return (int) s.codePoints().filter(cp -> cp != '\n' && cp != '\r').count();
    }

    public CursorPosition currentPosition() {
        return layout.positionOf(selection.cursor());
    }

    /** Pixel rectangle, in world coordinates, of the cell holding the offset's slot. */
    public Rectangle2D cellRectForOffset(int offset) {
        LayoutEngine.Slot s = layout.slot(offset);
        return geometry.cellRect(s.gcol(), s.row());
    }

    public Rectangle2D cursorRect() {
        return cellRectForOffset(selection.cursor());
    }

    // ---- Loading / saving ----

    /** Replaces the whole buffer with freshly loaded text; history restarts and the document is clean. */
    public void setPlainText(String newText) {
        text = NewlineMode.normalize(newText);
        length = CodePoints.length(text);
        selection.setLength(length);
        selection.set(selection.cursor(), selection.cursor());
        dirty = false;
        lastSaved = text;
        history.reset(snapshot());
        preedit = "";
        rebuildLayout();
        fireDirty();
        fireCount(characterCount());
    }

    public void markSaved() {
        lastSaved = text;
        dirty = false;
        fireDirty();
    }

    // ---- Grid ----

    public void setGrid(ManuscriptGrid grid) {
        if (grid == null || grid.equals(this.grid)) return;
        this.grid = grid;
        rebuildLayout();
    }

    public void setCellSize(int cellSize) {
        int size = Math.max(PageGeometry.MIN_CELL, cellSize);
        if (size == this.cellSize) return;
        this.cellSize = size;
        rebuildLayout();
    }

    // ---- Editing ----

    /**
     * Replaces [lo, hi) with {@code insert} (line breaks normalized to '\n') and puts the caret
     * after the inserted text. Records history unless the result equals the current entry.
     */
    public void replaceRange(int lo, int hi, String insert) {
        int a = CodePoints.clamp(Math.min(lo, hi), 0, length);
        int b = CodePoints.clamp(Math.max(lo, hi), 0, length);
        String ins = NewlineMode.normalize(insert);
        String newText = text.substring(0, CodePoints.charIndex(text, a))
                + ins
                + text.substring(CodePoints.charIndex(text, b));
        int caret = a + CodePoints.length(ins);
        applyEdit(newText, caret, caret);
    }

    public void replaceSelection(String insert) {
        CursorModel.Range r = selection.selectedRange();
        replaceRange(r.start(), r.end(), insert);
    }

    /** Typed or pasted text; replaces the selection. */
    public void insertText(String s) {
        if (readOnly || s == null || s.isEmpty()) return;
        replaceSelection(s);
    }

    public void deleteBackward() {
        if (readOnly) return;
        if (selection.hasSelection()) {
            replaceSelection("");
            return;
        }
        int idx = selection.cursor();
        if (idx <= 0) return;
        replaceRange(idx - 1, idx, "");
    }

    public void deleteForward() {
        if (readOnly) return;
        if (selection.hasSelection()) {
            replaceSelection("");
            return;
        }
        int idx = selection.cursor();
        if (idx >= length) return;
        replaceRange(idx, idx + 1, "");
    }

    public void undo() {
        EditHistory.Snapshot s = history.undo();
        if (s != null) restore(s);
    }

    public void redo() {
        EditHistory.Snapshot s = history.redo();
        if (s != null) restore(s);
    }

    private void applyEdit(String newText, int newCursor, int newAnchor) {
        int oldCount = characterCount();
        preedit = "";
        text = newText;
        length = CodePoints.length(text);
        selection.setLength(length);
        selection.set(newCursor, newAnchor);
        dirty = !text.equals(lastSaved);

        history.record(snapshot());
        rebuildLayout();
        fireDirty();

        int newCount = characterCount();
        if (newCount != oldCount) fireCount(newCount);
    }

    private void restore(EditHistory.Snapshot s) {
        text = s.text();
        length = CodePoints.length(text);
        selection.setLength(length);
        selection.set(s.cursor(), s.anchor());
        dirty = !text.equals(lastSaved);
        rebuildLayout();
        fireDirty();
        fireCount(characterCount());
    }

    private EditHistory.Snapshot snapshot() {
        return new EditHistory.Snapshot(text, selection.cursor(), selection.anchor());
    }

    // ---- Preedit (input method composition) ----

    public String preedit() { return preedit; }

    public void setPreedit(String composing) {
        String next = composing == null ? "" : composing;
        if (next.equals(preedit)) return;
        preedit = next;
        fireContent();
    }

    /** Cells the current composition string is drawn in, starting at the cursor slot. */
    public List<LayoutEngine.Unit> preeditCells() {
        return layout.overlayCells(selection.cursor(), preedit);
    }

    // ---- Cursor movement ----

    public void moveVisual(int deltaCol, int deltaRow, boolean keepAnchor) {
        int target = selection.visualTarget(layout, deltaCol, deltaRow);
        selection.moveTo(target, keepAnchor);
        cursorMoved();
    }

    public void moveTo(int offset, boolean keepAnchor) {
        selection.moveTo(offset, keepAnchor);
        cursorMoved();
    }

    public void moveToStart(boolean keepAnchor) {
        moveTo(0, keepAnchor);
    }

    public void moveToEnd(boolean keepAnchor) {
        moveTo(length, keepAnchor);
    }

    /** Places the cursor at the offset nearest to a world point; {@code extend} keeps the anchor. */
    public void clickAt(double worldX, double worldY, boolean extend) {
        LayoutEngine.Slot cell = geometry.pointToGrid(worldX, worldY);
        int idx = layout.nearestOffset(cell.gcol(), cell.row());
        selection.moveTo(idx, extend);
        cursorMoved();
    }

    public void selectAll() {
        selection.selectAll();
        cursorMoved();
    }

    public void clearSelection() {
        selection.clearSelection();
        fireContent();
    }

    // ---- Search ----

    /**
     * Finds the next (or previous) occurrence, wrapping around once, and selects it
     * with the cursor at the match end.
     *
     * @return false if the pattern is empty or not found
     * @throws InvalidPatternException if a regex pattern does not compile
     */
    public boolean find(String pattern, boolean forward, boolean isRegex, boolean caseSensitive) throws InvalidPatternException {
        TextSearch.Match m = TextSearch.find(text, pattern, selection.cursor(), selection.anchor(),
                forward, isRegex, caseSensitive);
        if (m == null) return false;
        selection.set(m.end(), m.start());
        cursorMoved();
        return true;
    }

    // ---- Layout and events ----

    private void rebuildLayout() {
        layout = LayoutEngine.layout(text, grid);
        geometry = new PageGeometry(grid, cellSize, layout.totalPages());
        cursorMoved();
    }

    private void cursorMoved() {
        Rectangle2D rect = cursorRect();
        CursorPosition pos = currentPosition();
        for (ManuscriptListener l : List.copyOf(listeners)) {
            l.revealRequested(rect);
            l.cursorPositionChanged(pos);
            l.contentChanged();
        }
    }

    private void fireContent() {
        for (ManuscriptListener l : List.copyOf(listeners)) {
            l.contentChanged();
        }
    }

    private void fireDirty() {
        for (ManuscriptListener l : List.copyOf(listeners)) {
            l.dirtyChanged(dirty);
        }
    }

    private void fireCount(int count) {
        for (ManuscriptListener l : List.copyOf(listeners)) {
            l.characterCountChanged(count);
        }
    }
}
