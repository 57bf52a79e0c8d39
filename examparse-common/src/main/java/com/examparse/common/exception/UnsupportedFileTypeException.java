package com.examparse.common.exception;

public class UnsupportedFileTypeException extends ExamParseException {

    public UnsupportedFileTypeException(String message) {
        super(ErrorCode.UNSUPPORTED_FILE_TYPE, message);
    }
}
