package genko;

import java.util.Set;

/**
 * Kinsoku shori character classes.
 * LINE_HEAD: may not open a column (closing punctuation and brackets).
 * LINE_END: may not close a column (opening brackets and quotes).
 */
public final class Kinsoku {

    private static final Set<String> LINE_HEAD_PROHIBITED = Set.of(
            "、", "。", "，", "．", "！", "？", ")", "]", "｝", "〕", "〉", "》", "」", "』", "】");

    private static final Set<String> LINE_END_PROHIBITED = Set.of(
            "(", "[", "｛", "〔", "〈", "《", "「", "『", "【");

    private Kinsoku() {}

    public static boolean isLineHeadProhibited(String text) {
        return LINE_HEAD_PROHIBITED.contains(text);
    }

    public static boolean isLineEndProhibited(String text) {
        return LINE_END_PROHIBITED.contains(text);
    }
}
