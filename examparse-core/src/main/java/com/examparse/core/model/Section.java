package com.examparse.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Independently parseable slice of a document. Carries either text (text mode) or the base64
 * PNG of each covered page (vision mode).
 */
@Value
@Builder(toBuilder = true)
public class Section {
    int index;
    String subjectHint;
    String label;
    @Builder.Default
    List<Integer> pageNumbers = List.of();
    String text;
    @Builder.Default
    List<String> pageImages = List.of();

    public boolean isVision() {
        return !pageImages.isEmpty();
    }

    public int firstPage() {
        return pageNumbers.isEmpty() ? 1 : pageNumbers.get(0);
    }

    public Section withIndex(int newIndex) {
        return toBuilder().index(newIndex).build();
    }
}
