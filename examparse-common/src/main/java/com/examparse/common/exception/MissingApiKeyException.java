package com.examparse.common.exception;

public class MissingApiKeyException extends ExamParseException {

    public MissingApiKeyException(String message) {
        super(ErrorCode.MISSING_API_KEY, message);
    }
}
