package com.examparse.core.validation;

import com.examparse.common.util.TextUtils;
import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.Question;
import com.examparse.core.model.QuestionValidationException;
import com.examparse.core.model.Section;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw model output into validated entities.
 *
 * <p>An empty {@link Optional} means the text was not JSON at all, which makes the caller retry
 * with a stricter instruction. Individual bad items are dropped and logged; they never fail
 * the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionResponseValidator {

    private final ObjectMapper objectMapper;
    private final SubjectCatalog subjectCatalog;

    public Optional<List<Question>> parseQuestions(String rawResponse, Section section) {
        Optional<JsonNode> items = readItems(rawResponse, "questions");
        if (items.isEmpty()) {
            return Optional.empty();
        }

        List<Question> questions = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items.get()) {
            buildQuestion(item, index++, section).ifPresent(questions::add);
        }

        log.info("[SECTIONS] Questions validated | section={} | items={} | accepted={}",
            section.getLabel(), items.get().size(), questions.size());
        return Optional.of(questions);
    }

    public Optional<List<AnswerRecord>> parseAnswers(String rawResponse, Section section) {
        Optional<JsonNode> items = readItems(rawResponse, "answers");
        if (items.isEmpty()) {
            return Optional.empty();
        }

        List<AnswerRecord> records = new ArrayList<>();
        for (JsonNode item : items.get()) {
            Integer id = readId(item.get("id"));
            String answer = text(item, "answer");
            if (id == null || answer.isBlank()) {
                log.debug("[SECTIONS] Answer item skipped | section={} | item={}", section.getLabel(), item);
                continue;
            }
            String subject = text(item, "subject");
            records.add(AnswerRecord.builder()
                .id(id)
                .subject(subject.isBlank() ? section.getSubjectHint() : subject)
                .answer(answer.strip())
                .explanation(text(item, "explanation"))
                .build());
        }

        log.info("[SECTIONS] Answers validated | section={} | items={} | accepted={}",
            section.getLabel(), items.get().size(), records.size());
        return Optional.of(records);
    }

    private Optional<JsonNode> readItems(String rawResponse, String listField) {
        String cleaned = JsonResponseCleaner.clean(rawResponse);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("[SECTIONS] Response is not valid JSON | error={} | preview={}",
                e.getOriginalMessage(), TextUtils.abbreviate(cleaned, 200));
            return Optional.empty();
        }

        if (root.isObject()) {
            root = root.has(listField) ? root.get(listField) : root.path("items");
        }
        if (!root.isArray()) {
            log.warn("[SECTIONS] Response has no item list | field={}", listField);
            return Optional.empty();
        }
        return Optional.of(root);
    }

    private Optional<Question> buildQuestion(JsonNode item, int index, Section section) {
        if (!item.isObject()) {
            return Optional.empty();
        }
        String questionText = text(item, "question_text");
        List<String> options = readOptions(item.get("options"));
        if (questionText.isBlank() || options.isEmpty()) {
            log.debug("[SECTIONS] Item dropped, missing question text or options | section={} | index={}",
                section.getLabel(), index);
            return Optional.empty();
        }

        String rawAnswer = text(item, "answer").strip();
        String answer = rawAnswer.isEmpty() || options.contains(rawAnswer)
            ? rawAnswer
            : AnswerMatcher.match(rawAnswer, options);

        String subject = text(item, "subject");
        if (subject.isBlank()) {
            subject = section.getSubjectHint() != null && !section.getSubjectHint().isBlank()
                ? section.getSubjectHint()
                : subjectCatalog.getFallback();
        }

        Integer id = readId(item.get("id"));
        Integer page = readId(item.get("page_number"));
        String context = text(item, "context");

        try {
            return Optional.of(Question.builder()
                .id(id == null ? 0 : id)
                .subject(subject.strip())
                .context(context.isBlank() ? null : context)
                .questionText(questionText)
                .options(options)
                .answer(answer)
                .explanation(text(item, "explanation"))
                .pageNumber(page == null || page < 1 ? section.firstPage() : page)
                .build());
        } catch (QuestionValidationException e) {
            log.warn("[SECTIONS] Item rejected | section={} | index={} | reason={}",
                section.getLabel(), index, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Options as a list, splitting a run-on string ("① A ② B ③ C") at its circled markers.
     */
    static List<String> readOptions(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> options = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(option -> options.add(option.isTextual() ? option.asText() : option.toString()));
        } else if (node.isValueNode()) {
            options.add(node.asText());
        }
        if (options.size() == 1) {
            List<String> split = splitRunOn(options.get(0));
            if (split.size() >= 2) {
                return split;
            }
        }
        return options;
    }

    private static List<String> splitRunOn(String options) {
        if (!CircledDigits.ANY.matcher(options).find()) {
            return List.of(options);
        }
        return Arrays.stream(CircledDigits.SPLIT_BEFORE.split(options))
            .map(String::strip)
            .filter(part -> !part.isEmpty())
            .toList();
    }

    private static Integer readId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        String value = node.asText().strip();
        return TextUtils.isAsciiDigits(value) && value.length() <= 6 ? Integer.parseInt(value) : null;
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
