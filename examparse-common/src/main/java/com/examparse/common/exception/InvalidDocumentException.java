package com.examparse.common.exception;

public class InvalidDocumentException extends ExamParseException {

    public InvalidDocumentException(String message) {
        super(ErrorCode.EMPTY_DOCUMENT, message);
    }
}
