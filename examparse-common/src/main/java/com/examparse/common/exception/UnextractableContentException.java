package com.examparse.common.exception;

import lombok.Getter;

/**
 * Raised when a document carries no usable text signal, typically an image-only scan.
 */
@Getter
public class UnextractableContentException extends ExamParseException {

    private final int extractedCharacters;

    public UnextractableContentException(String message, int extractedCharacters) {
        super(ErrorCode.UNEXTRACTABLE_CONTENT, message);
        this.extractedCharacters = extractedCharacters;
    }
}
