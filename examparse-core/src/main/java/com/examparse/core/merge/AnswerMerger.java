package com.examparse.core.merge;

import com.examparse.core.model.AnswerRecord;
import com.examparse.core.model.MergeResult;
import com.examparse.core.model.Question;
import com.examparse.core.validation.AnswerMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies answer-key records to questions.
 *
 * <p>Records are looked up by (normalised subject, id) and then by id alone, because question
 * numbers restart in every subject. The raw answer only lands on a question after it resolves to
 * one of that question's options; otherwise the answer becomes empty.
 */
@Component
@Slf4j
public class AnswerMerger {

    private static final Pattern SUBJECT_NOISE = Pattern.compile("[\\s·‧\\-_]");

    public MergeResult merge(List<Question> questions, List<AnswerRecord> records) {
        Map<String, AnswerRecord> bySubjectAndId = new HashMap<>();
        Map<Integer, AnswerRecord> byId = new HashMap<>();
        for (AnswerRecord record : records) {
            String subject = normalizeSubject(record.getSubject());
            if (!subject.isEmpty()) {
                bySubjectAndId.put(compositeKey(subject, record.getId()), record);
            }
            byId.put(record.getId(), record);
        }

        List<Question> merged = new ArrayList<>(questions.size());
        int matched = 0;
        for (Question question : questions) {
            AnswerRecord record = bySubjectAndId.get(compositeKey(normalizeSubject(question.getSubject()), question.getId()));
            if (record == null) {
                record = byId.get(question.getId());
            }
            if (record == null) {
                merged.add(question);
                continue;
            }

            String answer = AnswerMatcher.match(record.getAnswer(), question.getOptions());
            String explanation = record.getExplanation() != null && !record.getExplanation().isBlank()
                ? record.getExplanation()
                : question.getExplanation();
            merged.add(question.withAnswer(answer, explanation));
            if (!answer.isEmpty()) {
                matched++;
            }
        }

        log.info("[MERGE] Answers merged | matched={}/{} | records={}", matched, questions.size(), records.size());
        return new MergeResult(merged, matched);
    }

    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return SUBJECT_NOISE.matcher(subject).replaceAll("").toLowerCase();
    }

    private static String compositeKey(String subject, int id) {
        return subject + "#" + id;
    }
}
