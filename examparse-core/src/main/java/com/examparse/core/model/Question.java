package com.examparse.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One exam item. Instances are always valid: the constructor rejects anything that breaks the
 * invariants, and answers are replaced through {@link #withAnswer} which builds a new value.
 */
@Value
public class Question {

    int id;
    String subject;
    String context;
    String questionText;
    List<String> options;
    String answer;
    String explanation;
    int pageNumber;

    @Builder(toBuilder = true)
    @Jacksonized
    public Question(int id, String subject, String context, String questionText,
                    List<String> options, String answer, String explanation, Integer pageNumber) {
        if (id < 1) {
            throw new QuestionValidationException("id must be >= 1, was " + id);
        }
        if (subject == null || subject.isBlank()) {
            throw new QuestionValidationException("subject must not be blank (id=" + id + ")");
        }
        if (questionText == null || questionText.isBlank()) {
            throw new QuestionValidationException("question text must not be blank (id=" + id + ")");
        }
        if (options == null || options.size() < 2) {
            throw new QuestionValidationException("at least 2 options required (id=" + id + ")");
        }
        if (options.stream().anyMatch(o -> o == null)) {
            throw new QuestionValidationException("options must not contain null (id=" + id + ")");
        }
        String normalizedAnswer = answer == null ? "" : answer;
        if (!normalizedAnswer.isEmpty() && !options.contains(normalizedAnswer)) {
            throw new QuestionValidationException(
                "answer '" + normalizedAnswer + "' is not one of the options (id=" + id + ")");
        }
        int page = pageNumber == null ? 1 : pageNumber;
        if (page < 1) {
            throw new QuestionValidationException("page number must be >= 1, was " + page);
        }

        this.id = id;
        this.subject = subject;
        this.context = context;
        this.questionText = questionText;
        this.options = List.copyOf(options);
        this.answer = normalizedAnswer;
        this.explanation = explanation == null ? "" : explanation;
        this.pageNumber = page;
    }

    public Question withAnswer(String answer, String explanation) {
        return toBuilder()
            .answer(answer)
            .explanation(explanation)
            .build();
    }

    public boolean hasAnswer() {
        return !answer.isEmpty();
    }
}
