package genko;

import java.util.Map;

/**
 * Presentation forms used when drawing a cell in vertical writing. Punctuation and brackets
 * swap to their vertical glyphs; a lone ASCII letter or digit is drawn rotated a quarter turn.
 * TCY pairs are drawn upright as-is.
 */
public final class VerticalGlyphs {

    private static final Map<String, String> VERTICAL_FORMS = Map.ofEntries(
            Map.entry("、", "︑"),
            Map.entry("。", "︒"),
            Map.entry("「", "﹁"),
            Map.entry("」", "﹂"),
            Map.entry("『", "﹃"),
            Map.entry("』", "﹄"),
            Map.entry("（", "︵"),
            Map.entry("）", "︶"),
            Map.entry("［", "﹇"),
            Map.entry("］", "﹈"),
            Map.entry("｛", "︷"),
            Map.entry("｝", "︸"),
            Map.entry("〈", "︿"),
            Map.entry("〉", "﹀"),
            Map.entry("《", "︽"),
            Map.entry("》", "︾"),
            Map.entry("【", "︻"),
            Map.entry("】", "︼"),
            Map.entry("ー", "｜"));

    private VerticalGlyphs() {}

    public static String displayText(LayoutEngine.Unit unit) {
        if (unit.kind() == Tokenizer.Kind.TCY) return unit.text();
        return displayText(unit.text());
    }

    public static String displayText(String text) {
        return VERTICAL_FORMS.getOrDefault(text, text);
    }

    /** True for a single ASCII letter or digit, which is laid on its side. */
    public static boolean isRotated(String displayText) {
        if (displayText.length() != 1) return false;
        char c = displayText.charAt(0);
        return c < 128 && Character.isLetterOrDigit(c);
    }
}
