package com.examparse.core.segment;

import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.model.Section;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits tagged document text at subject headers.
 *
 * <p>Text in front of the first header belongs to the first section, since layouts sometimes
 * print the header after the first block of content.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubjectSegmenter {

    private final SubjectCatalog subjectCatalog;

    public List<Section> split(String taggedText) {
        Pattern headerPattern = subjectCatalog.headerPattern();
        Matcher matcher = headerPattern.matcher(taggedText);

        List<int[]> headers = new ArrayList<>();
        List<String> names = new ArrayList<>();
        while (matcher.find()) {
            headers.add(new int[]{matcher.start(), matcher.end()});
            names.add(SubjectCatalog.normalizeHeader(matcher.group(1)));
        }

        List<Section> sections = new ArrayList<>();
        String preHeader = headers.isEmpty() ? "" : taggedText.substring(0, headers.get(0)[0]).strip();
        int preHeaderStart = 0;

        for (int i = 0; i < headers.size(); i++) {
            int contentStart = headers.get(i)[1];
            int contentEnd = i + 1 < headers.size() ? headers.get(i + 1)[0] : taggedText.length();
            String content = taggedText.substring(contentStart, contentEnd).strip();
            int pageStart = contentStart;

            if (!preHeader.isEmpty()) {
                content = preHeader + "\n" + content;
                pageStart = preHeaderStart;
                preHeader = "";
            }
            if (content.isEmpty()) {
                continue;
            }

            sections.add(Section.builder()
                .index(sections.size())
                .subjectHint(names.get(i))
                .label(names.get(i))
                .pageNumbers(PageMarkers.pagesIn(taggedText, pageStart, contentEnd))
                .text(content)
                .build());
        }

        if (sections.isEmpty()) {
            log.info("[SEGMENT] No subject headers found, using a single section | fallback={}",
                subjectCatalog.getFallback());
            return List.of(Section.builder()
                .index(0)
                .subjectHint(subjectCatalog.getFallback())
                .label(subjectCatalog.getFallback())
                .pageNumbers(PageMarkers.pagesIn(taggedText, 0, taggedText.length()))
                .text(taggedText.strip())
                .build());
        }

        log.info("[SEGMENT] Text split by subject | headers={} | sections={} | labels={}",
            headers.size(), sections.size(), sections.stream().map(Section::getLabel).toList());
        return sections;
    }
}
