package com.examparse.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractionResult {

    public static final String PAGE_MARKER_FORMAT = "[PAGE %d]";

    ExtractionMode mode;
    @Builder.Default
    List<String> pageContents = List.of();
    @Builder.Default
    List<List<String>> underlinedSpans = List.of();
    @Builder.Default
    List<String> pageImages = List.of();
    int totalPages;
    double nearEmptyPageRatio;
    boolean likelyScanned;
    int nonWhitespaceChars;

    /**
     * All page texts, each preceded by its {@code [PAGE n]} marker.
     */
    public String taggedText() {
        StringBuilder tagged = new StringBuilder();
        for (int i = 0; i < pageContents.size(); i++) {
            tagged.append('\n')
                .append(String.format(PAGE_MARKER_FORMAT, i + 1))
                .append('\n')
                .append(pageContents.get(i))
                .append('\n');
        }
        return tagged.toString();
    }

    public String plainText() {
        return String.join("\n", pageContents);
    }
}
