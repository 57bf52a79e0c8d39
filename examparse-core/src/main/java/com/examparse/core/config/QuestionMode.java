package com.examparse.core.config;

/**
 * How question booklets are read. {@code AUTO} starts with the text layer and switches to
 * page images when the document looks scanned.
 */
public enum QuestionMode {
    AUTO,
    TEXT,
    VISION
}
