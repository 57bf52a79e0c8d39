package com.examparse.core.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one section. {@code failed} means the model could not be reached or the worker
 * threw; a section whose response held nothing usable is not failed, just empty.
 */
@Value
public class SectionResult<T> {
    int sectionIndex;
    String label;
    List<T> items;
    boolean failed;
    String error;
    long durationMs;

    public static <T> SectionResult<T> success(Section section, List<T> items, long durationMs) {
        return new SectionResult<>(section.getIndex(), section.getLabel(), List.copyOf(items), false, null, durationMs);
    }

    public static <T> SectionResult<T> failed(Section section, String error, long durationMs) {
        return new SectionResult<>(section.getIndex(), section.getLabel(), List.of(), true, error, durationMs);
    }
}
