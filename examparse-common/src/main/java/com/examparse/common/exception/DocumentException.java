package com.examparse.common.exception;

/**
 * The bytes could not be opened as a PDF document.
 */
public class DocumentException extends ExamParseException {

    public DocumentException(String message, Throwable cause) {
        super(ErrorCode.UNREADABLE_DOCUMENT, message, cause);
    }
}
