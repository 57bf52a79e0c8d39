package com.examparse.core.model;

/**
 * A single extracted item violates the {@link Question} invariants. Callers drop the item and
 * keep the rest of the batch.
 */
public class QuestionValidationException extends RuntimeException {

    public QuestionValidationException(String message) {
        super(message);
    }
}
