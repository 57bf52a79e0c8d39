package com.examparse.core.processor.impl;

import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.ExtractionMode;
import com.examparse.core.model.ExtractionResult;
import com.examparse.core.support.PdfFixtures;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfVisionProcessorTest {

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    @Test
    void extract_rendersEveryPageAsBase64Png() {
        ExtractionProperties properties = new ExtractionProperties();
        properties.getPdf().setVisionDpi(20);
        PdfVisionProcessor processor = new PdfVisionProcessor(properties);
        byte[] pdf = PdfFixtures.textPdf(List.of(List.of("page one"), List.of("page two")));

        ExtractionResult result = processor.extract(pdf);

        assertThat(processor.supports(ExtractionMode.VISION)).isTrue();
        assertThat(result.getMode()).isEqualTo(ExtractionMode.VISION);
        assertThat(result.getPageImages()).hasSize(2);
        byte[] firstPage = Base64.getDecoder().decode(result.getPageImages().get(0));
        assertThat(firstPage).startsWith(PNG_SIGNATURE);
    }
}
