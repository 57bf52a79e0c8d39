package com.examparse.core.model;

public enum ExtractionMode {
    TEXT,
    VISION
}
