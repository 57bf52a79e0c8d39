package com.examparse.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Answer-key entry as read from the document. The raw answer token is only checked against a
 * question's options when the two are merged.
 */
@Value
public class AnswerRecord {

    int id;
    String subject;
    String answer;
    String explanation;

    @Builder
    @Jacksonized
    public AnswerRecord(int id, String subject, String answer, String explanation) {
        this.id = id;
        this.subject = subject;
        this.answer = answer == null ? "" : answer;
        this.explanation = explanation;
    }
}
