package genko;

import java.awt.*;

/**
 * Centralizes theme + font handling for the manuscript pane.
 */
public class ThemeManager {

    public static final String LIGHT = "Light";
    public static final String SOFT_DARK = "Soft Dark";

    public record ThemePalette(Color background, Color pageBackground, Color grid,
                               Color text, Color selection, Color cursor) {}

    private int editorFontSize = 16;
    private String themeName = LIGHT;

    public int fontSize() { return editorFontSize; }
    public String themeName() { return themeName; }

    public void setFontSize(int size) { this.editorFontSize = CodePoints.clamp(size, 8, 64); }

    public void setThemeName(String name) {
        this.themeName = SOFT_DARK.equalsIgnoreCase(name) ? SOFT_DARK : LIGHT;
    }

    public void apply(ManuscriptPane pane) {
        pane.applyFont(new Font(Font.SERIF, Font.PLAIN, editorFontSize));
        pane.applyPalette(paletteForName(themeName));
    }

    public ThemePalette paletteForName(String theme) {
        boolean dark = SOFT_DARK.equalsIgnoreCase(theme);
        if (dark) {
            return new ThemePalette(
                    new Color(0x20, 0x26, 0x2e),
                    new Color(0x2a, 0x31, 0x3b),
                    new Color(0x46, 0x51, 0x5f),
                    new Color(0xdc, 0xe3, 0xec),
                    new Color(0x4d, 0x6e, 0xa1),
                    new Color(0x8b, 0xb7, 0xff));
        }
        return new ThemePalette(
                new Color(0xf3, 0xe9, 0xde),
                new Color(0xff, 0xfa, 0xf4),
                new Color(0xd8, 0xc6, 0xb2),
                new Color(0x3a, 0x2d, 0x24),
                new Color(0xd7, 0xe3, 0xf5),
                new Color(0x7c, 0x4f, 0x2f));
    }
}
