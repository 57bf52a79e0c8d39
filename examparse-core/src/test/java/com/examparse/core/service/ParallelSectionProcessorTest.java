package com.examparse.core.service;

import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ParallelSectionProcessor")
class ParallelSectionProcessorTest {

    private ParallelSectionProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ParallelSectionProcessor(new ExtractionProperties());
    }

    @AfterEach
    void tearDown() {
        processor.shutdown();
    }

    private static List<Section> sections(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> Section.builder().index(i).label("s" + i).text("text " + i).build())
            .toList();
    }

    @Test
    @DisplayName("Results come back in submission order even when later sections finish first")
    void shouldPreserveSubmissionOrder() {
        CountDownLatch lastFinished = new CountDownLatch(1);

        List<SectionResult<String>> results = processor.process("test", sections(3), section -> {
            if (section.getIndex() == 0) {
                try {
                    lastFinished.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            SectionResult<String> result = SectionResult.success(section, List.of("item-" + section.getIndex()), 0);
            if (section.getIndex() == 2) {
                lastFinished.countDown();
            }
            return result;
        });

        assertThat(results).extracting(SectionResult::getSectionIndex).containsExactly(0, 1, 2);
        assertThat(results).flatExtracting(SectionResult::getItems).containsExactly("item-0", "item-1", "item-2");
    }

    @Test
    @DisplayName("A throwing section becomes a failed result and siblings still complete")
    void shouldContainSectionFailure() {
        List<SectionResult<String>> results = processor.process("test", sections(2), section -> {
            if (section.getIndex() == 0) {
                throw new IllegalStateException("retries exhausted");
            }
            return SectionResult.success(section, List.of("a", "b", "c"), 0);
        });

        assertThat(results.get(0).isFailed()).isTrue();
        assertThat(results.get(0).getError()).isEqualTo("retries exhausted");
        assertThat(results.get(0).getItems()).isEmpty();
        assertThat(results.get(1).isFailed()).isFalse();
        assertThat(results.get(1).getItems()).hasSize(3);
    }

    @Test
    void shouldHandleNoSections() {
        assertThat(processor.<String>process("test", List.of(), section -> SectionResult.success(section, List.of(), 0)))
            .isEmpty();
    }
}
