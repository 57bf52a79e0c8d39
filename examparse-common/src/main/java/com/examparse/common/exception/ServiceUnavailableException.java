package com.examparse.common.exception;

public class ServiceUnavailableException extends ExamParseException {

    public ServiceUnavailableException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }
}
