package com.examparse.core.service;

import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs sections concurrently on a small fixed pool and returns their results in submission order.
 * The pool is deliberately small since every task is a large model request.
 *
 * <p>A task that throws is reported as a failed {@link SectionResult}; it never affects its siblings.
 */
@Service
@Slf4j
public class ParallelSectionProcessor {

    private final int workers;
    private final ExecutorService executorService;

    public ParallelSectionProcessor(ExtractionProperties properties) {
        this.workers = Math.max(1, properties.getExtraction().getWorkers());
        AtomicInteger threadCount = new AtomicInteger();
        this.executorService = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "section-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> List<SectionResult<T>> process(String processId, List<Section> sections,
                                              Function<Section, SectionResult<T>> task) {
        long startTime = System.currentTimeMillis();
        log.info("[SECTIONS] Starting parallel extraction | processId={} | sections={} | workers={}",
            processId, sections.size(), workers);

        List<CompletableFuture<SectionResult<T>>> futures = sections.stream()
            .map(section -> processAsync(processId, section, task))
            .collect(Collectors.toList());

        List<SectionResult<T>> results = new ArrayList<>(sections.size());
        int failed = 0;
        int items = 0;
        for (int i = 0; i < futures.size(); i++) {
            SectionResult<T> result;
            try {
                result = futures.get(i).join();
            } catch (RuntimeException e) {
                log.error("[SECTIONS] Section future failed | processId={} | section={} | error={}",
                    processId, sections.get(i).getLabel(), e.getMessage(), e);
                result = SectionResult.failed(sections.get(i), e.getMessage(), 0);
            }
            if (result.isFailed()) {
                failed++;
            }
            items += result.getItems().size();
            results.add(result);
        }

        log.info("[SECTIONS] Parallel extraction completed | processId={} | sections={} | failed={} | items={} | totalDurationMs={}",
            processId, sections.size(), failed, items, System.currentTimeMillis() - startTime);
        return results;
    }

    private <T> CompletableFuture<SectionResult<T>> processAsync(String processId, Section section,
                                                                 Function<Section, SectionResult<T>> task) {
        return CompletableFuture.supplyAsync(() -> {
            long sectionStart = System.currentTimeMillis();
            try {
                SectionResult<T> result = task.apply(section);
                log.debug("[SECTIONS] Section done | processId={} | section={} | items={} | durationMs={}",
                    processId, section.getLabel(), result.getItems().size(), System.currentTimeMillis() - sectionStart);
                return result;
            } catch (Exception e) {
                long duration = System.currentTimeMillis() - sectionStart;
                log.error("[SECTIONS] Section failed | processId={} | section={} | durationMs={} | error={}",
                    processId, section.getLabel(), duration, e.getMessage(), e);
                return SectionResult.failed(section, e.getMessage(), duration);
            }
        }, executorService);
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }
}
