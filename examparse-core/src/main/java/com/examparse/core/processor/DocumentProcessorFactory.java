package com.examparse.core.processor;

import com.examparse.core.model.ExtractionMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class DocumentProcessorFactory {

    private final List<DocumentProcessor> processors;

    public DocumentProcessor getProcessor(ExtractionMode mode) {
        return processors.stream()
            .filter(p -> p.supports(mode))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported extraction mode: " + mode));
    }
}
