package com.examparse.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Document-level failure reasons surfaced to callers of the pipeline.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    EMPTY_DOCUMENT("INPUT_ERROR", "The uploaded document is empty"),
    UNREADABLE_DOCUMENT("INPUT_ERROR", "The document could not be opened as a PDF"),
    DOCUMENT_TOO_LARGE("INPUT_ERROR", "The document exceeds the supported size"),
    UNSUPPORTED_FILE_TYPE("INPUT_ERROR", "Only PDF documents are supported"),
    UNEXTRACTABLE_CONTENT("UNEXTRACTABLE_CONTENT", "No usable text could be extracted from the document"),
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", "The extraction service is temporarily unavailable"),
    MISSING_API_KEY("CONFIGURATION_ERROR", "No API key has been configured for the extraction service");

    private final String category;
    private final String defaultMessage;
}
