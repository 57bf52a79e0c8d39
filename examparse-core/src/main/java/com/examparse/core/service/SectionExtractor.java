package com.examparse.core.service;

import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.Question;
import com.examparse.core.model.Section;
import com.examparse.core.model.SectionResult;
import com.examparse.core.validation.QuestionResponseValidator;
import com.examparse.llm.client.GeminiPart;
import com.examparse.llm.prompt.ExtractionPrompts;
import com.examparse.llm.service.LlmExtractionClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One section through the model: a call, validation, and a second call demanding pure JSON
 * when the first response could not be parsed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionExtractor {

    private final LlmExtractionClient llmClient;
    private final QuestionResponseValidator validator;

    public SectionResult<Question> extractQuestions(Section section, String systemPrompt) {
        List<GeminiPart> parts = new ArrayList<>();
        if (section.isVision()) {
            parts.add(GeminiPart.text(ExtractionPrompts.buildImageGroupMessage(section.getPageNumbers())));
            section.getPageImages().forEach(image -> parts.add(GeminiPart.pngImage(image)));
        } else {
            parts.add(GeminiPart.text(ExtractionPrompts.buildTextSectionMessage(section.getSubjectHint(), section.getText())));
        }
        return extract(section, systemPrompt, parts, raw -> validator.parseQuestions(raw, section));
    }

    public SectionResult<AnswerRecord> extractAnswers(Section section) {
        List<GeminiPart> parts = List.of(GeminiPart.text(
            ExtractionPrompts.buildAnswerSectionMessage(section.getSubjectHint(), section.getText())));
        return extract(section, ExtractionPrompts.ANSWER_SYSTEM_PROMPT, parts, raw -> validator.parseAnswers(raw, section));
    }

    private <T> SectionResult<T> extract(Section section, String systemPrompt, List<GeminiPart> parts,
                                         Function<String, Optional<List<T>>> parser) {
        long startTime = System.currentTimeMillis();

        Optional<String> response = llmClient.call(systemPrompt, parts);
        if (response.isEmpty()) {
            return SectionResult.failed(section, "No model response after retries", System.currentTimeMillis() - startTime);
        }

        Optional<List<T>> parsed = parser.apply(response.get());
        if (parsed.isPresent()) {
            return SectionResult.success(section, parsed.get(), System.currentTimeMillis() - startTime);
        }

        log.warn("[SECTIONS] Unparseable response, asking again for strict JSON | section={}", section.getLabel());
        List<GeminiPart> strictParts = new ArrayList<>(parts);
        strictParts.add(GeminiPart.text(ExtractionPrompts.STRICT_JSON_SUFFIX));

        Optional<String> retry = llmClient.call(systemPrompt, strictParts);
        if (retry.isEmpty()) {
            return SectionResult.failed(section, "No model response after retries", System.currentTimeMillis() - startTime);
        }

        parsed = parser.apply(retry.get());
        if (parsed.isEmpty()) {
            log.warn("[SECTIONS] Second response also unparseable, section yields no items | section={}",
                section.getLabel());
            return SectionResult.success(section, List.of(), System.currentTimeMillis() - startTime);
        }
        return SectionResult.success(section, parsed.get(), System.currentTimeMillis() - startTime);
    }
}
