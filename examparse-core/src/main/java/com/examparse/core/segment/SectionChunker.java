package com.examparse.core.segment;

import com.examparse.common.util.TokenCounter;
import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.Section;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each model call within size limits by cutting oversized sections along page markers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionChunker {

    private final ExtractionProperties properties;

    public List<Section> chunk(List<Section> sections) {
        int maxChars = properties.getChunking().getMaxSectionChars();
        List<Section> chunks = new ArrayList<>();

        for (Section section : sections) {
            String text = section.getText();
            if (text == null || text.length() <= maxChars) {
                chunks.add(section.withIndex(chunks.size()));
                continue;
            }

            List<Section> pieces = splitByPages(section);
            log.info("[SEGMENT] Section chunked | label={} | chars={} | estimatedTokens={} | chunks={}",
                section.getLabel(), text.length(), TokenCounter.countTokens(text), pieces.size());
            for (Section piece : pieces) {
                chunks.add(piece.withIndex(chunks.size()));
            }
        }
        return chunks;
    }

    private List<Section> splitByPages(Section section) {
        String text = section.getText();
        List<int[]> markers = PageMarkers.markers(text);
        if (markers.size() < 2) {
            log.warn("[SEGMENT] Oversized section has no page boundaries to split on | label={} | chars={}",
                section.getLabel(), text.length());
            return List.of(section);
        }

        // page texts; anything before the first marker stays with the first page
        List<String> pageTexts = new ArrayList<>();
        List<Integer> pageNumbers = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            int start = i == 0 ? 0 : markers.get(i)[0];
            int end = i + 1 < markers.size() ? markers.get(i + 1)[0] : text.length();
            pageTexts.add(text.substring(start, end));
            pageNumbers.add(markers.get(i)[1]);
        }

        int pagesPerChunk = Math.max(1, properties.getChunking().getPagesPerChunk());
        List<Section> pieces = new ArrayList<>();
        for (int from = 0; from < pageTexts.size(); from += pagesPerChunk) {
            int to = Math.min(from + pagesPerChunk, pageTexts.size());
            String chunkText = String.join("", pageTexts.subList(from, to)).strip();
            if (chunkText.isEmpty()) {
                continue;
            }
            List<Integer> pages = new ArrayList<>(pageNumbers.subList(from, to));
            if (from == 0 && !section.getPageNumbers().isEmpty() && !pages.contains(section.firstPage())) {
                pages.add(0, section.firstPage());
            }
            pieces.add(section.toBuilder()
                .label(section.getSubjectHint() + "#" + (pieces.size() + 1))
                .pageNumbers(pages)
                .text(chunkText)
                .build());
        }
        return pieces;
    }
}
