package genko;

import java.awt.geom.Rectangle2D;

/** Change notifications from a {@link ManuscriptDocument}. All methods default to no-ops. */
public interface ManuscriptListener {

    default void characterCountChanged(int count) {}

    default void dirtyChanged(boolean dirty) {}

    default void cursorPositionChanged(CursorPosition position) {}

    /** The cursor cell, in world coordinates, that the view should scroll into sight. */
    default void revealRequested(Rectangle2D cell) {}

    /** Layout, selection or preedit changed and the view needs a repaint. */
    default void contentChanged() {}
}
