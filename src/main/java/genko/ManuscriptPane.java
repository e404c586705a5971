package genko;

import javax.swing.*;
import java.awt.*;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.event.ActionEvent;
import java.awt.event.InputEvent;
import java.awt.event.InputMethodEvent;
import java.awt.event.InputMethodListener;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.font.TextHitInfo;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.awt.im.InputMethodRequests;
import java.text.AttributedCharacterIterator;
import java.text.AttributedString;
import java.text.CharacterIterator;

/**
 * Live view of a {@link ManuscriptDocument}: paints the page strip and routes mouse, keyboard and
 * input-method events back into the document. Meant to sit inside a {@link JScrollPane}; cursor
 * reveals are applied to the enclosing viewport.
 */
public class ManuscriptPane extends JComponent implements ManuscriptListener {

    static final String ACTION_LEFT = "caret-next-column";
    static final String ACTION_RIGHT = "caret-previous-column";
    static final String ACTION_UP = "caret-up";
    static final String ACTION_DOWN = "caret-down";
    static final String ACTION_HOME = "caret-begin";
    static final String ACTION_END = "caret-end";
    static final String ACTION_UNDO = "undo";
    static final String ACTION_REDO = "redo";
    static final String ACTION_SELECT_ALL = "select-all";
    static final String ACTION_COPY = "copy";
    static final String ACTION_CUT = "cut";
    static final String ACTION_PASTE = "paste";
    static final String ACTION_NEWLINE = "insert-break";
    static final String ACTION_BACKSPACE = "delete-previous";
    static final String ACTION_DELETE = "delete-next";
    static final String ACTION_INDENT = "insert-ideographic-space";

    private static final String IDEOGRAPHIC_SPACE = "　";

    private final ManuscriptDocument doc;
    private ThemeManager.ThemePalette palette = new ThemeManager().paletteForName(ThemeManager.LIGHT);
    private boolean showGrid = true;
    private boolean caretVisible = true;
    private final Timer blinkTimer;
    private Dimension lastPreferred;

    public ManuscriptPane(ManuscriptDocument doc) {
        this.doc = doc;
        setOpaque(true);
        setFocusable(true);
        setFocusTraversalKeysEnabled(false);
        enableInputMethods(true);

        blinkTimer = new Timer(520, e -> {
            caretVisible = !caretVisible;
            repaint();
        });

        applyFont(new Font(Font.SERIF, Font.PLAIN, 16));
        doc.addListener(this);
        lastPreferred = getPreferredSize();

        addMouseListener(new MouseAdapter() {
            @Override public void mousePressed(MouseEvent e) {
                if (!SwingUtilities.isLeftMouseButton(e)) return;
                requestFocusInWindow();
                doc.clickAt(e.getX(), e.getY(), e.isShiftDown());
                caretVisible = true;
            }
        });
        addKeyListener(new KeyAdapter() {
            @Override public void keyTyped(KeyEvent e) {
                char c = e.getKeyChar();
                if (c == KeyEvent.CHAR_UNDEFINED || Character.isISOControl(c)) return;
                int blocked = InputEvent.CTRL_DOWN_MASK | InputEvent.ALT_DOWN_MASK | InputEvent.META_DOWN_MASK;
                if ((e.getModifiersEx() & blocked) != 0) return;
                doc.insertText(String.valueOf(c));
                e.consume();
            }
        });
        addInputMethodListener(new ImeHandler());
        installKeyBindings();
    }

    // ---- Public API ----

    public ManuscriptDocument document() {
        return doc;
    }

    public void applyFont(Font font) {
        if (font == null) return;
        setFont(font);
        FontMetrics fm = getFontMetrics(font);
        doc.setCellSize(PageGeometry.cellSizeForFontHeight(fm.getHeight()));
        contentChanged();
    }

    public void applyPalette(ThemeManager.ThemePalette palette) {
        if (palette == null) return;
        this.palette = palette;
        setBackground(palette.background());
        repaint();
    }

    public ThemeManager.ThemePalette palette() {
        return palette;
    }

    public void setShowGrid(boolean showGrid) {
        this.showGrid = showGrid;
        repaint();
    }

    public boolean isShowGrid() {
        return showGrid;
    }

    @Override public Dimension getPreferredSize() {
        PageGeometry g = doc.geometry();
        return new Dimension(g.totalWidth(), g.totalHeight());
    }

    @Override public void addNotify() {
        super.addNotify();
        blinkTimer.start();
    }

    @Override public void removeNotify() {
        blinkTimer.stop();
        super.removeNotify();
    }

    // ---- ManuscriptListener ----

    @Override public void revealRequested(Rectangle2D cell) {
        JViewport vp = (JViewport) SwingUtilities.getAncestorOfClass(JViewport.class, this);
        if (vp == null) return;
        Dimension size = getPreferredSize();
        Rectangle view = vp.getViewRect();
        PageGeometry.Viewport v = new PageGeometry.Viewport(
                view.x, view.y, view.width, view.height,
                Math.max(0, size.width - view.width),
                Math.max(0, size.height - view.height));
        PageGeometry.ScrollPosition pos = PageGeometry.scrollToReveal(v, cell);
        if (pos.x() != view.x || pos.y() != view.y) {
            vp.setViewPosition(new Point(pos.x(), pos.y()));
        }
    }

    @Override public void contentChanged() {
        Dimension pref = getPreferredSize();
        if (!pref.equals(lastPreferred)) {
            lastPreferred = pref;
            revalidate();
        }
        repaint();
    }

    // ---- Painting ----

    @Override protected void paintComponent(Graphics g0) {
        Graphics2D g = (Graphics2D) g0.create();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            Rectangle clip = g.getClipBounds();
            if (clip == null) clip = new Rectangle(0, 0, getWidth(), getHeight());
            g.setColor(palette.background());
            g.fillRect(clip.x, clip.y, clip.width, clip.height);

            PageGeometry geo = doc.geometry();
            LayoutEngine.Result layout = doc.layout();
            paintPages(g, geo, clip);
            paintUnits(g, geo, layout, clip);
            paintPreedit(g, geo, clip);
            paintCaret(g, geo);
        } finally {
            g.dispose();
        }
    }

    private void paintPages(Graphics2D g, PageGeometry geo, Rectangle clip) {
        int rows = geo.grid().rows();
        int cols = geo.grid().cols();
        int cell = geo.cellSize();
        int page = 0;
        while (page < geo.totalPages()) {
            Rectangle2D.Double r = geo.pageRect(page);
            page = page + 1;
            if (!r.intersects(clip)) continue;
            g.setColor(palette.pageBackground());
            g.fill(r);
            if (!showGrid) continue;
            g.setColor(palette.grid());
            int left = (int) r.x;
            int top = (int) r.y;
            int i = 0;
            while (i <= rows) {
                int y = top + i * cell;
                g.drawLine(left, y, left + cols * cell, y);
                i = i + 1;
            }
            i = 0;
            while (i <= cols) {
                int x = left + i * cell;
                g.drawLine(x, top, x, top + rows * cell);
                i = i + 1;
            }
        }
    }

    private void paintUnits(Graphics2D g, PageGeometry geo, LayoutEngine.Result layout, Rectangle clip) {
        Font base = cellFont(geo, 0.72f);
        Font tcy = cellFont(geo, 0.58f);
        CursorModel.Range sel = doc.selectedRange();

        for (LayoutEngine.Unit unit : layout.units()) {
            Rectangle2D.Double rect = geo.cellRect(unit.gcol(), unit.row());
            if (!rect.intersects(clip)) continue;
            if (!sel.isEmpty() && unit.start() < sel.end() && unit.end() > sel.start()) {
                g.setColor(palette.selection());
                g.fill(rect);
            }
            g.setColor(palette.text());
            if (unit.kind() == Tokenizer.Kind.TCY) {
                drawCentered(g, tcy, unit.text(), rect, false);
            } else {
                String text = VerticalGlyphs.displayText(unit);
                drawCentered(g, base, text, rect, VerticalGlyphs.isRotated(text));
            }
        }
    }

    private void paintPreedit(Graphics2D g, PageGeometry geo, Rectangle clip) {
        if (doc.preedit().isEmpty()) return;
        Font base = cellFont(geo, 0.72f);
        Color fg = new Color(palette.text().getRed(), palette.text().getGreen(), palette.text().getBlue(), 190);
        Color bg = new Color(palette.selection().getRed(), palette.selection().getGreen(), palette.selection().getBlue(), 90);
        for (LayoutEngine.Unit cell : doc.preeditCells()) {
            Rectangle2D.Double rect = geo.cellRect(cell.gcol(), cell.row());
            if (!rect.intersects(clip)) continue;
            g.setColor(bg);
            g.fill(rect);
            g.setColor(fg);
            String text = VerticalGlyphs.displayText(cell.text());
            drawCentered(g, base, text, rect, VerticalGlyphs.isRotated(text));
            g.setColor(fg.darker());
            int y = (int) rect.getMaxY() - 3;
            g.drawLine((int) rect.x + 4, y, (int) rect.getMaxX() - 4, y);
        }
    }

    private void paintCaret(Graphics2D g, PageGeometry geo) {
        if (!hasFocus() || !caretVisible) return;
        LayoutEngine.Slot s = doc.layout().slot(doc.cursor());
        Rectangle2D.Double rect = geo.cellRect(s.gcol(), s.row());
        g.setColor(palette.cursor());
        int x = (int) rect.getMaxX() - 3;
        g.drawLine(x, (int) rect.y + 3, x, (int) rect.getMaxY() - 3);
    }

    private Font cellFont(PageGeometry geo, float ratio) {
        float px = Math.max(8f, geo.cellSize() * ratio);
        return getFont().deriveFont(px);
    }

    private static void drawCentered(Graphics2D g, Font font, String text, Rectangle2D.Double rect, boolean rotate) {
        g.setFont(font);
        FontMetrics fm = g.getFontMetrics();
        int w = fm.stringWidth(text);
        int ascent = fm.getAscent();
        int descent = fm.getDescent();
        if (!rotate) {
            float x = (float) (rect.getCenterX() - w / 2.0);
            float y = (float) (rect.getCenterY() + (ascent - descent) / 2.0);
            g.drawString(text, x, y);
            return;
        }
        AffineTransform saved = g.getTransform();
        g.translate(rect.getCenterX(), rect.getCenterY());
        g.rotate(Math.PI / 2);
        g.drawString(text, (float) (-w / 2.0), (float) ((ascent - descent) / 2.0));
        g.setTransform(saved);
    }

    // ---- Keyboard ----

    private void installKeyBindings() {
        int menu = menuShortcutMask();
        int shift = InputEvent.SHIFT_DOWN_MASK;
        InputMap im = getInputMap(JComponent.WHEN_FOCUSED);
        ActionMap am = getActionMap();

        bindMove(im, am, KeyEvent.VK_LEFT, ACTION_LEFT, shift, keep -> doc.moveVisual(+1, 0, keep));
        bindMove(im, am, KeyEvent.VK_RIGHT, ACTION_RIGHT, shift, keep -> doc.moveVisual(-1, 0, keep));
        bindMove(im, am, KeyEvent.VK_UP, ACTION_UP, shift, keep -> doc.moveVisual(0, -1, keep));
        bindMove(im, am, KeyEvent.VK_DOWN, ACTION_DOWN, shift, keep -> doc.moveVisual(0, +1, keep));
        bindMove(im, am, KeyEvent.VK_HOME, ACTION_HOME, shift, doc::moveToStart);
        bindMove(im, am, KeyEvent.VK_END, ACTION_END, shift, doc::moveToEnd);

        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_Z, menu), ACTION_UNDO, doc::undo);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_Y, menu), ACTION_REDO, doc::redo);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_A, menu), ACTION_SELECT_ALL, doc::selectAll);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_C, menu), ACTION_COPY, this::copySelection);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_X, menu), ACTION_CUT, this::cutSelection);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_V, menu), ACTION_PASTE, this::paste);

        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_ENTER, 0), ACTION_NEWLINE, () -> doc.insertText("\n"));
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_BACK_SPACE, 0), ACTION_BACKSPACE, doc::deleteBackward);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_DELETE, 0), ACTION_DELETE, doc::deleteForward);
        bind(im, am, KeyStroke.getKeyStroke(KeyEvent.VK_TAB, 0), ACTION_INDENT, () -> doc.insertText(IDEOGRAPHIC_SPACE));
    }

    private interface MoveCommand {
        void move(boolean keepAnchor);
    }

    private void bindMove(InputMap im, ActionMap am, int key, String name, int shift, MoveCommand cmd) {
        bind(im, am, KeyStroke.getKeyStroke(key, 0), name, () -> cmd.move(false));
        bind(im, am, KeyStroke.getKeyStroke(key, shift), name + "-extend", () -> cmd.move(true));
    }

    private void bind(InputMap im, ActionMap am, KeyStroke stroke, String name, Runnable r) {
        im.put(stroke, name);
        am.put(name, new AbstractAction() {
            @Override public void actionPerformed(ActionEvent e) {
                caretVisible = true;
                r.run();
            }
        });
    }

    private static int menuShortcutMask() {
        if (GraphicsEnvironment.isHeadless()) return InputEvent.CTRL_DOWN_MASK;
        return Toolkit.getDefaultToolkit().getMenuShortcutKeyMaskEx();
    }

    // ---- Clipboard ----

    private void copySelection() {
        String text = doc.selectedText();
        if (text.isEmpty()) return;
        Clipboard cb = systemClipboard();
        if (cb == null) return;
        try {
            cb.setContents(new StringSelection(text), null);
        } catch (IllegalStateException ex) {
            DebugLog.log("clipboard", "busy, copy skipped: %s", ex.getMessage());
        }
    }

    private void cutSelection() {
        if (doc.isReadOnly() || !doc.hasSelection()) return;
        copySelection();
        doc.replaceSelection("");
    }

    private void paste() {
        if (doc.isReadOnly()) return;
        Clipboard cb = systemClipboard();
        if (cb == null) return;
        try {
            if (!cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) return;
            String clip = (String) cb.getData(DataFlavor.stringFlavor);
            doc.insertText(clip);
        } catch (Exception ex) {
            DebugLog.log("clipboard", "read failed: %s", ex.getMessage());
        }
    }

    private static Clipboard systemClipboard() {
        if (GraphicsEnvironment.isHeadless()) return null;
        return Toolkit.getDefaultToolkit().getSystemClipboard();
    }

    // ---- Input method ----

    @Override public InputMethodRequests getInputMethodRequests() {
        return new ImeRequests();
    }

    /** Committed text goes into the buffer; the composed remainder becomes the preedit overlay. */
    private final class ImeHandler implements InputMethodListener {
        @Override public void inputMethodTextChanged(InputMethodEvent e) {
            if (doc.isReadOnly()) {
                e.consume();
                return;
            }
            AttributedCharacterIterator it = e.getText();
            StringBuilder committed = new StringBuilder();
            StringBuilder composed = new StringBuilder();
            if (it != null) {
                int count = e.getCommittedCharacterCount();
                char c = it.first();
                while (c != CharacterIterator.DONE) {
                    if (count > 0) {
                        committed.append(c);
                        count = count - 1;
                    } else {
                        composed.append(c);
                    }
                    c = it.next();
                }
            }
            if (committed.length() > 0) {
                doc.insertText(committed.toString());
            }
            doc.setPreedit(composed.toString());
            e.consume();
        }

        @Override public void caretPositionChanged(InputMethodEvent e) {
            e.consume();
        }
    }

    private final class ImeRequests implements InputMethodRequests {
        @Override public Rectangle getTextLocation(TextHitInfo offset) {
            Rectangle r = doc.cursorRect().getBounds();
            if (isShowing()) {
                Point p = getLocationOnScreen();
                r.translate(p.x, p.y);
            }
            return r;
        }

        @Override public TextHitInfo getLocationOffset(int x, int y) { return null; }
        @Override public int getInsertPositionOffset() { return CodePoints.charIndex(doc.text(), doc.cursor()); }

        @Override public AttributedCharacterIterator getCommittedText(int beginIndex, int endIndex,
                                                                     AttributedCharacterIterator.Attribute[] attributes) {
            String text = doc.text();
            int b = CodePoints.clamp(beginIndex, 0, text.length());
            int e = CodePoints.clamp(endIndex, b, text.length());
            return new AttributedString(text.substring(b, e)).getIterator();
        }

        @Override public int getCommittedTextLength() { return doc.text().length(); }

        @Override public AttributedCharacterIterator cancelLatestCommittedText(AttributedCharacterIterator.Attribute[] attributes) {
            return null;
        }

        @Override public AttributedCharacterIterator getSelectedText(AttributedCharacterIterator.Attribute[] attributes) {
            return new AttributedString(doc.selectedText()).getIterator();
        }
    }
}
