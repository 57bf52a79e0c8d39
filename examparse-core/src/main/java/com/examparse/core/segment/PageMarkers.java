package com.examparse.core.segment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the {@code [PAGE n]} markers in tagged document text.
 */
final class PageMarkers {

    static final Pattern MARKER = Pattern.compile("\\[PAGE (\\d+)]");

    private PageMarkers() {}

    /**
     * Page in effect at {@code position}: the last marker that starts before it, or 0 when none does.
     */
    static int pageAt(String text, int position) {
        Matcher matcher = MARKER.matcher(text);
        int page = 0;
        while (matcher.find() && matcher.start() < position) {
            page = Integer.parseInt(matcher.group(1));
        }
        return page;
    }

    /**
     * Pages covered by {@code text[start, end)}, including the page already open at {@code start}.
     */
    static List<Integer> pagesIn(String text, int start, int end) {
        Set<Integer> pages = new LinkedHashSet<>();
        int open = pageAt(text, start);
        if (open > 0) {
            pages.add(open);
        }
        Matcher matcher = MARKER.matcher(text);
        matcher.region(start, end);
        while (matcher.find()) {
            pages.add(Integer.parseInt(matcher.group(1)));
        }
        return new ArrayList<>(pages);
    }

    /**
     * Start offsets of every marker, in order.
     */
    static List<int[]> markers(String text) {
        List<int[]> found = new ArrayList<>();
        Matcher matcher = MARKER.matcher(text);
        while (matcher.find()) {
            found.add(new int[]{matcher.start(), Integer.parseInt(matcher.group(1))});
        }
        return found;
    }
}
