package com.examparse.core.parser;

import com.examparse.common.util.TextUtils;
import com.examparse.core.config.SubjectCatalog;
import com.examparse.core.model.AnswerRecord;
import com.examparse.core.validation.CircledDigits;
import com.examparse.llm.prompt.ExtractionPrompts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads the common rigid answer-key layout without a model call.
 *
 * <p>The table prints, for every row, each subject's block of 5 question numbers followed by its
 * 5 answers. With N subjects a row is therefore 10 x N tokens long:
 * <pre>
 *   1 2 3 4 5 ① ③ ② ④ ⑤ | 1 2 3 4 5 ② ② ① ③ ④ | ...   (row 1, subject 1 | subject 2 | ...)
 *   6 7 8 9 10 ...                                       (row 2)
 * </pre>
 * The result is all-or-nothing: any inconsistency returns an empty list so the caller falls back
 * to model extraction.
 *
 * <p>Cell borders sit just under each token's baseline and come out of the text processor as
 * underline markers; they are removed before the table is read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnswerTableParser {

    static final int GROUP_SIZE = 5;
    static final int BLOCK_SIZE = GROUP_SIZE * 2;
    static final int MIN_SUBJECTS = 2;
    private static final Set<String> COLUMN_LABELS = Set.of("문제번호", "정답", "Question No.", "Answer");

    private final SubjectCatalog subjectCatalog;

    public List<AnswerRecord> parse(String markedText) {
        if (markedText == null || markedText.isBlank()) {
            return List.of();
        }
        String text = ExtractionPrompts.stripUnderlineMarkers(markedText);

        List<String> subjects = subjectCatalog.detectSubjects(text);
        if (subjects.size() < MIN_SUBJECTS) {
            log.debug("[ANSWER_TABLE] Not a multi-subject table | subjects={}", subjects);
            return List.of();
        }

        List<String> tokens = collectTokens(text);
        if (tokens.isEmpty()) {
            log.debug("[ANSWER_TABLE] No numeric tokens found");
            return List.of();
        }

        int subjectCount = subjects.size();
        int rowSize = BLOCK_SIZE * subjectCount;
        List<AnswerRecord> records = new ArrayList<>();

        int pos = 0;
        while (pos + rowSize <= tokens.size()) {
            for (int s = 0; s < subjectCount; s++) {
                readBlock(tokens, pos + s * BLOCK_SIZE, subjects.get(s), records);
            }
            pos += rowSize;
        }

        // short last row: as many whole subject blocks as remain
        int subject = 0;
        while (pos + BLOCK_SIZE <= tokens.size() && subject < subjectCount) {
            readBlock(tokens, pos, subjects.get(subject), records);
            pos += BLOCK_SIZE;
            subject++;
        }

        if (!isConsistent(records, subjects)) {
            return List.of();
        }

        log.info("[ANSWER_TABLE] Parsed answer table | records={} | subjects={}", records.size(), subjects);
        return List.copyOf(records);
    }

    private List<String> collectTokens(String text) {
        String[] lines = text.split("\n", -1);
        int dataStart = 0;
        for (int i = 0; i < lines.length; i++) {
            if (COLUMN_LABELS.contains(lines[i].strip())) {
                dataStart = i + 1;
            }
        }

        List<String> tokens = new ArrayList<>();
        for (int i = dataStart; i < lines.length; i++) {
            String line = lines[i].strip();
            if (TextUtils.isAsciiDigits(line) || CircledDigits.isGlyph(line)) {
                tokens.add(line);
            }
        }
        return tokens;
    }

    private void readBlock(List<String> tokens, int start, String subject, List<AnswerRecord> records) {
        for (int j = 0; j < GROUP_SIZE; j++) {
            String number = tokens.get(start + j);
            if (!TextUtils.isAsciiDigits(number) || number.length() > 4) {
                continue;
            }
            records.add(AnswerRecord.builder()
                .id(Integer.parseInt(number))
                .subject(subject)
                .answer(tokens.get(start + GROUP_SIZE + j))
                .explanation("")
                .build());
        }
    }

    private boolean isConsistent(List<AnswerRecord> records, List<String> subjects) {
        int floor = BLOCK_SIZE * subjects.size() / 2;
        if (records.size() < floor) {
            log.warn("[ANSWER_TABLE] Too few records, discarding table | records={} | minimum={}",
                records.size(), floor);
            return false;
        }

        Map<String, List<Integer>> idsBySubject = new LinkedHashMap<>();
        records.forEach(r -> idsBySubject.computeIfAbsent(r.getSubject(), k -> new ArrayList<>()).add(r.getId()));

        for (String subject : subjects) {
            List<Integer> ids = idsBySubject.getOrDefault(subject, List.of());
            if (!isGaplessFromOne(ids)) {
                log.warn("[ANSWER_TABLE] Question numbers out of sequence, discarding table | subject={} | ids={}",
                    subject, ids.size() > 10 ? ids.subList(0, 10) + "..." : ids);
                return false;
            }
        }
        return true;
    }

    private static boolean isGaplessFromOne(List<Integer> ids) {
        if (ids.isEmpty()) {
            return false;
        }
        List<Integer> sortedUnique = new ArrayList<>(new TreeSet<>(ids));
        if (!ids.equals(sortedUnique)) {
            return false;
        }
        return sortedUnique.get(0) == 1 && sortedUnique.get(sortedUnique.size() - 1) == sortedUnique.size();
    }
}
