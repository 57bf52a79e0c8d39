package com.examparse.core.processor;

import com.examparse.common.exception.DocumentException;
import com.examparse.common.exception.InvalidDocumentException;
import com.examparse.common.exception.SizeLimitException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.IOException;

/**
 * Opening rules shared by all PDF processors.
 */
@Slf4j
public final class PdfDocuments {

    private PdfDocuments() {}

    /**
     * Load the document and enforce the page ceiling before any page is touched.
     * The caller owns the returned document and must close it.
     */
    public static PDDocument open(byte[] pdfBytes, int maxPages) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new InvalidDocumentException("PDF file is empty");
        }

        PDDocument document;
        try {
            document = Loader.loadPDF(pdfBytes);
        } catch (IOException e) {
            log.warn("[PDF] Failed to open document | sizeBytes={} | error={}", pdfBytes.length, e.getMessage());
            throw new DocumentException("Could not open PDF: " + e.getMessage(), e);
        }

        int pages = document.getNumberOfPages();
        if (pages > maxPages) {
            closeQuietly(document);
            log.warn("[PDF] Page limit exceeded | pages={} | maxPages={}", pages, maxPages);
            throw new SizeLimitException(
                String.format("PDF has too many pages (%d). At most %d pages are supported.", pages, maxPages),
                pages, maxPages);
        }
        return document;
    }

    private static void closeQuietly(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.debug("[PDF] Failed to close rejected document | error={}", e.getMessage());
        }
    }
}
