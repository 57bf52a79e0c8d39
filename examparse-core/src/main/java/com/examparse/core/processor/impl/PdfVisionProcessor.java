package com.examparse.core.processor.impl;

import com.examparse.common.exception.DocumentException;
import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.ExtractionMode;
import com.examparse.core.model.ExtractionResult;
import com.examparse.core.processor.DocumentProcessor;
import com.examparse.core.processor.PdfDocuments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Renders every page to a PNG for the multimodal path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfVisionProcessor implements DocumentProcessor {

    private final ExtractionProperties properties;

    @Override
    public boolean supports(ExtractionMode mode) {
        return mode == ExtractionMode.VISION;
    }

    @Override
    public ExtractionResult extract(byte[] pdfBytes) {
        ExtractionProperties.Pdf pdf = properties.getPdf();
        long startTime = System.currentTimeMillis();

        try (PDDocument document = PdfDocuments.open(pdfBytes, pdf.getMaxPages())) {
            PDFRenderer renderer = new PDFRenderer(document);
            int totalPages = document.getNumberOfPages();
            List<String> pageImages = new ArrayList<>();

            for (int i = 0; i < totalPages; i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, pdf.getVisionDpi(), ImageType.RGB);
                ByteArrayOutputStream png = new ByteArrayOutputStream();
                ImageIO.write(image, "png", png);
                pageImages.add(Base64.getEncoder().encodeToString(png.toByteArray()));
                log.debug("[PDF] Page rendered | page={}/{} | sizeKb={}", i + 1, totalPages, png.size() / 1024);
            }

            log.info("[PDF] Pages rendered | pages={} | dpi={} | durationMs={}",
                totalPages, pdf.getVisionDpi(), System.currentTimeMillis() - startTime);

            return ExtractionResult.builder()
                .mode(ExtractionMode.VISION)
                .pageImages(pageImages)
                .totalPages(totalPages)
                .build();
        } catch (IOException e) {
            throw new DocumentException("Failed to render PDF pages: " + e.getMessage(), e);
        }
    }
}
