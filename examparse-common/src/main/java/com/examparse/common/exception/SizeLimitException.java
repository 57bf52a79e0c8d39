package com.examparse.common.exception;

import lombok.Getter;

@Getter
public class SizeLimitException extends ExamParseException {

    private final long actual;
    private final long limit;

    public SizeLimitException(String message, long actual, long limit) {
        super(ErrorCode.DOCUMENT_TOO_LARGE, message);
        this.actual = actual;
        this.limit = limit;
    }
}
