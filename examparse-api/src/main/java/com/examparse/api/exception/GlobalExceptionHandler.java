package com.examparse.api.exception;

import com.examparse.api.dto.response.ErrorResponse;
import com.examparse.common.exception.ErrorCode;
import com.examparse.common.exception.ExamParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ExamParseException.class)
    public ResponseEntity<ErrorResponse> handleExamParseException(
            ExamParseException ex,
            WebRequest request
    ) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("[PIPELINE] Parse failed | code={} | message={}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("[PIPELINE] Parse rejected | code={} | message={}", ex.getErrorCode(), ex.getMessage());
        }
        return build(status, ex.getErrorCode().getCategory(), ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", errors.toString().trim(), request);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissingPartException(
            Exception ex,
            WebRequest request
    ) {
        log.warn("[PIPELINE] Missing request part | message={}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INPUT_ERROR",
            "Required multipart field 'file' is not present. Send the PDF as multipart/form-data.", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        // Question construction failures arrive here wrapped by Jackson
        Throwable cause = ex.getMostSpecificCause();
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", cause.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUpload(
            MaxUploadSizeExceededException ex,
            WebRequest request
    ) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "INPUT_ERROR",
            ErrorCode.DOCUMENT_TOO_LARGE.getDefaultMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case DOCUMENT_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
            case UNEXTRACTABLE_CONTENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SERVICE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case EMPTY_DOCUMENT, UNREADABLE_DOCUMENT, UNSUPPORTED_FILE_TYPE, MISSING_API_KEY -> HttpStatus.BAD_REQUEST;
        };
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }
}
