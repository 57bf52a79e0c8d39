package com.examparse.core.processor.impl;

import com.examparse.common.exception.DocumentException;
import com.examparse.common.util.TextUtils;
import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.ExtractionMode;
import com.examparse.core.model.ExtractionResult;
import com.examparse.core.processor.DocumentProcessor;
import com.examparse.core.processor.PdfDocuments;
import com.examparse.llm.prompt.ExtractionPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-layer extraction, one page at a time, with underline markers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfTextProcessor implements DocumentProcessor {

    private static final String ADJACENT_MARKERS =
        ExtractionPrompts.UNDERLINE_END + " " + ExtractionPrompts.UNDERLINE_START;
    private static final Pattern UNDERLINED_SPAN = Pattern.compile(
        Pattern.quote(ExtractionPrompts.UNDERLINE_START) + "(.*?)" + Pattern.quote(ExtractionPrompts.UNDERLINE_END));

    private final ExtractionProperties properties;

    @Override
    public boolean supports(ExtractionMode mode) {
        return mode == ExtractionMode.TEXT;
    }

    @Override
    public ExtractionResult extract(byte[] pdfBytes) {
        ExtractionProperties.Pdf pdf = properties.getPdf();
        long startTime = System.currentTimeMillis();

        try (PDDocument document = PdfDocuments.open(pdfBytes, pdf.getMaxPages())) {
            int totalPages = document.getNumberOfPages();
            List<String> pageContents = new ArrayList<>();
            List<List<String>> underlinedSpans = new ArrayList<>();
            int nearEmptyPages = 0;
            int nonWhitespace = 0;

            for (int page = 1; page <= totalPages; page++) {
                String pageText = extractPage(document, page);
                int pageChars = TextUtils.countNonWhitespace(ExtractionPrompts.stripUnderlineMarkers(pageText));
                if (pageChars < pdf.getNearEmptyPageChars()) {
                    nearEmptyPages++;
                }
                nonWhitespace += pageChars;
                pageContents.add(pageText);
                underlinedSpans.add(findUnderlinedSpans(pageText));
            }

            double nearEmptyRatio = totalPages == 0 ? 1.0 : (double) nearEmptyPages / totalPages;
            boolean likelyScanned = nearEmptyRatio > pdf.getScannedPageRatio();
            if (likelyScanned) {
                log.warn("[PDF] Document looks scanned | nearEmptyPages={}/{} | ratio={}",
                    nearEmptyPages, totalPages, String.format("%.2f", nearEmptyRatio));
            }

            int underlineCount = underlinedSpans.stream().mapToInt(List::size).sum();
            log.info("[PDF] Text extracted | pages={} | nonWhitespaceChars={} | underlinedSpans={} | durationMs={}",
                totalPages, nonWhitespace, underlineCount, System.currentTimeMillis() - startTime);

            return ExtractionResult.builder()
                .mode(ExtractionMode.TEXT)
                .pageContents(pageContents)
                .underlinedSpans(underlinedSpans)
                .totalPages(totalPages)
                .nearEmptyPageRatio(nearEmptyRatio)
                .likelyScanned(likelyScanned)
                .nonWhitespaceChars(nonWhitespace)
                .build();
        } catch (IOException e) {
            throw new DocumentException("Failed to read PDF text: " + e.getMessage(), e);
        }
    }

    private String extractPage(PDDocument document, int pageNumber) throws IOException {
        PDPage page = document.getPage(pageNumber - 1);
        List<UnderlineSegment> segments = new UnderlineCollector(page).collect();

        UnderlineAwareTextStripper stripper = new UnderlineAwareTextStripper(segments);
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        String text = stripper.getText(document);
        return text == null ? "" : text.replace(ADJACENT_MARKERS, " ").trim();
    }

    static List<String> findUnderlinedSpans(String pageText) {
        List<String> spans = new ArrayList<>();
        Matcher matcher = UNDERLINED_SPAN.matcher(pageText);
        while (matcher.find()) {
            spans.add(matcher.group(1));
        }
        return spans;
    }
}
