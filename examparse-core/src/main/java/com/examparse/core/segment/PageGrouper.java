package com.examparse.core.segment;

import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.Section;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Batches rendered pages so one model call sees passages that run across consecutive pages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageGrouper {

    private final ExtractionProperties properties;

    public List<Section> group(List<String> pageImages) {
        int groupSize = Math.max(1, properties.getPdf().getPagesPerGroup());
        List<Section> groups = new ArrayList<>();

        for (int from = 0; from < pageImages.size(); from += groupSize) {
            int to = Math.min(from + groupSize, pageImages.size());
            List<Integer> pages = new ArrayList<>();
            for (int page = from + 1; page <= to; page++) {
                pages.add(page);
            }
            groups.add(Section.builder()
                .index(groups.size())
                .label("pages " + (from + 1) + "-" + to)
                .pageNumbers(pages)
                .pageImages(List.copyOf(pageImages.subList(from, to)))
                .build());
        }

        log.info("[SEGMENT] Pages grouped | pages={} | groupSize={} | groups={}",
            pageImages.size(), groupSize, groups.size());
        return groups;
    }
}
