package com.examparse.core.processor;

import com.examparse.core.model.ExtractionMode;
import com.examparse.core.model.ExtractionResult;

public interface DocumentProcessor {
    boolean supports(ExtractionMode mode);
    ExtractionResult extract(byte[] pdfBytes);
}
