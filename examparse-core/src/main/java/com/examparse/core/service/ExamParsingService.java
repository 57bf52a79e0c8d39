package com.examparse.core.service;

import com.examparse.common.exception.ExamParseException;
import com.examparse.common.exception.InvalidDocumentException;
import com.examparse.common.exception.MissingApiKeyException;
import com.examparse.common.exception.ServiceUnavailableException;
import com.examparse.common.exception.UnextractableContentException;
import com.examparse.core.config.ExtractionProperties;
import com.examparse.core.config.QuestionMode;
import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.merge.AnswerMerger;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.ExtractionMode;
import com.examparse.core.model.ExtractionResult;
import com.examparse.core.model.MergeResult;
import com.examparse.core.model.Question;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import com.examparse.core.parser.AnswerTableParser;
import com.examparse.core.processor.DocumentProcessorFactory;
import com.examparse.core.segment.PageGrouper;
import com.examparse.core.segment.SectionChunker;
import com.examparse.core.segment.SubjectSegmenter;
import com.examparse.llm.client.GeminiClientProvider;
import com.examparse.llm.prompt.ExtractionPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pipeline entry point: question booklets and answer keys in, validated records out.
 *
 * <p>Only document-level problems (empty, unreadable, too large, no text signal) and a total
 * outage of the model surface as exceptions from {@link #parseQuestions}. Answer keys never fail;
 * they degrade to an empty list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExamParsingService {

    private final ExtractionProperties properties;
    private final SubjectCatalog subjectCatalog;
    private final DocumentProcessorFactory processorFactory;
    private final SubjectSegmenter segmenter;
    private final SectionChunker chunker;
    private final PageGrouper pageGrouper;
    private final AnswerTableParser answerTableParser;
    private final SectionExtractor sectionExtractor;
    private final ParallelSectionProcessor parallelProcessor;
    private final AnswerMerger answerMerger;
    private final GeminiClientProvider clientProvider;

    public List<Question> parseQuestions(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new InvalidDocumentException("PDF file is empty");
        }
        long startTime = System.currentTimeMillis();
        String processId = newProcessId("questions");
        QuestionMode mode = properties.getExtraction().getQuestionMode();
        log.info("[PIPELINE] Parsing question booklet | processId={} | sizeBytes={} | mode={}",
            processId, pdfBytes.length, mode);

        List<Section> sections = questionSections(pdfBytes, mode, processId);
        if (!clientProvider.hasApiKey()) {
            throw new MissingApiKeyException("Gemini API key is not set. Set GEMINI_API_KEY or provide one at runtime.");
        }

        String systemPrompt = ExtractionPrompts.questionSystemPrompt(subjectCatalog.getNames());
        List<SectionResult<Question>> results = parallelProcessor.process(processId, sections,
            section -> sectionExtractor.extractQuestions(section, systemPrompt));

        List<Question> questions = new ArrayList<>();
        results.forEach(result -> questions.addAll(result.getItems()));

        boolean allFailed = !results.isEmpty() && results.stream().allMatch(SectionResult::isFailed);
        if (allFailed && questions.isEmpty()) {
            log.error("[PIPELINE] Every section failed | processId={} | sections={}", processId, results.size());
            throw new ServiceUnavailableException(
                "The extraction service did not respond for any section. Please try again later.");
        }

        log.info("[PIPELINE] Question booklet parsed | processId={} | sections={} | questions={} | durationMs={}",
            processId, sections.size(), questions.size(), System.currentTimeMillis() - startTime);
        return questions;
    }

    public List<AnswerRecord> parseAnswerKey(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            log.warn("[PIPELINE] Empty answer key, nothing to parse");
            return List.of();
        }
        long startTime = System.currentTimeMillis();
        String processId = newProcessId("answers");

        ExtractionResult extraction;
        try {
            extraction = processorFactory.getProcessor(ExtractionMode.TEXT).extract(pdfBytes);
        } catch (ExamParseException e) {
            log.warn("[PIPELINE] Answer key could not be read | processId={} | reason={} | error={}",
                processId, e.getErrorCode(), e.getMessage());
            return List.of();
        }

        List<AnswerRecord> tableRecords = answerTableParser.parse(extraction.plainText());
        if (!tableRecords.isEmpty()) {
            log.info("[PIPELINE] Answer key parsed from table | processId={} | records={} | durationMs={}",
                processId, tableRecords.size(), System.currentTimeMillis() - startTime);
            return tableRecords;
        }

        if (!clientProvider.hasApiKey()) {
            log.warn("[PIPELINE] Answer table not recognised and no API key for model fallback | processId={}", processId);
            return List.of();
        }

        log.info("[PIPELINE] Answer table not recognised, falling back to model extraction | processId={}", processId);
        List<Section> sections = chunker.chunk(segmenter.split(extraction.taggedText()));
        List<AnswerRecord> records = new ArrayList<>();
        parallelProcessor.process(processId, sections, sectionExtractor::extractAnswers)
            .forEach(result -> records.addAll(result.getItems()));

        log.info("[PIPELINE] Answer key parsed by model | processId={} | sections={} | records={} | durationMs={}",
            processId, sections.size(), records.size(), System.currentTimeMillis() - startTime);
        return records;
    }

    public MergeResult merge(List<Question> questions, List<AnswerRecord> records) {
        return answerMerger.merge(questions, records);
    }

    public void updateApiKey(String apiKey) {
        clientProvider.updateApiKey(apiKey);
    }

    private List<Section> questionSections(byte[] pdfBytes, QuestionMode mode, String processId) {
        if (mode == QuestionMode.VISION) {
            return visionSections(pdfBytes, processId);
        }

        ExtractionResult text = processorFactory.getProcessor(ExtractionMode.TEXT).extract(pdfBytes);
        int minChars = properties.getPdf().getMinTextChars();
        boolean tooLittleText = text.getNonWhitespaceChars() < minChars;

        if (mode == QuestionMode.AUTO && (tooLittleText || text.isLikelyScanned())) {
            log.info("[PIPELINE] Switching to page images | processId={} | nonWhitespaceChars={} | likelyScanned={}",
                processId, text.getNonWhitespaceChars(), text.isLikelyScanned());
            return visionSections(pdfBytes, processId);
        }
        if (tooLittleText) {
            throw new UnextractableContentException(String.format(
                "Only %d characters of text could be extracted. The PDF is probably a scan; "
                    + "please upload a text-based PDF.", text.getNonWhitespaceChars()),
                text.getNonWhitespaceChars());
        }
        return chunker.chunk(segmenter.split(text.taggedText()));
    }

    private List<Section> visionSections(byte[] pdfBytes, String processId) {
        ExtractionResult images = processorFactory.getProcessor(ExtractionMode.VISION).extract(pdfBytes);
        if (images.getPageImages().isEmpty()) {
            log.warn("[PIPELINE] Document has no pages to render | processId={}", processId);
            throw new UnextractableContentException("The PDF contains no pages.", 0);
        }
        return pageGrouper.group(images.getPageImages());
    }

    private static String newProcessId(String kind) {
        return kind + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
