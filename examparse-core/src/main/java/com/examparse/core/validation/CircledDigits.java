package com.examparse.core.validation;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The ①..⑩ ordinal glyphs used as option and answer markers.
 */
public final class CircledDigits {

    private static final List<String> GLYPHS = List.of("①", "②", "③", "④", "⑤", "⑥", "⑦", "⑧", "⑨", "⑩");

    /** Position just before each glyph, for splitting run-on option strings. */
    public static final Pattern SPLIT_BEFORE = Pattern.compile("(?=[①-⑩])");
    public static final Pattern ANY = Pattern.compile("[①-⑩]");

    private CircledDigits() {}

    /**
     * Glyph for 1..10, or empty string outside that range.
     */
    public static String forNumber(int number) {
        return number >= 1 && number <= GLYPHS.size() ? GLYPHS.get(number - 1) : "";
    }

    public static boolean isGlyph(String token) {
        return GLYPHS.contains(token);
    }
}
