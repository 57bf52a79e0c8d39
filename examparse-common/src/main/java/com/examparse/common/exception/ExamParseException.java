package com.examparse.common.exception;

import lombok.Getter;

/**
 * Base type for failures that abort a whole document parse.
 * Section and item level problems never surface through this hierarchy.
 */
@Getter
public class ExamParseException extends RuntimeException {

    private final ErrorCode errorCode;

    public ExamParseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ExamParseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
