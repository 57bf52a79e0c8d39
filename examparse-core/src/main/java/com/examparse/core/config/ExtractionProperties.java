package com.examparse.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "examparse")
@Getter
@Setter
public class ExtractionProperties {

    private Pdf pdf = new Pdf();
    private Chunking chunking = new Chunking();
    private Extraction extraction = new Extraction();

    @Getter
    @Setter
    public static class Pdf {
        private int maxPages = 200;
        private int nearEmptyPageChars = 20;
        private double scannedPageRatio = 0.5;
        private int minTextChars = 100;
        private float visionDpi = 200;
        private int pagesPerGroup = 3;
    }

    @Getter
    @Setter
    public static class Chunking {
        private int maxSectionChars = 30_000;
        private int pagesPerChunk = 5;
    }

    @Getter
    @Setter
    public static class Extraction {
        private int workers = 3;
        private QuestionMode questionMode = QuestionMode.AUTO;
    }
}
