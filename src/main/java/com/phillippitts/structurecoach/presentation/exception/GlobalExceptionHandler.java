package com.phillippitts.structurecoach.presentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;
import com.phillippitts.structurecoach.exception.InvalidAudioException;
import com.phillippitts.structurecoach.exception.InvalidSectionException;
import com.phillippitts.structurecoach.exception.InvalidTimeSpentException;
import com.phillippitts.structurecoach.exception.QuestionIndexOutOfRangeException;
import com.phillippitts.structurecoach.exception.ReportSynthesisException;
import com.phillippitts.structurecoach.exception.ResourceNotFoundException;
import com.phillippitts.structurecoach.exception.StorageException;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Validation failures name the offending field and, where the set is closed, the
 * acceptable values. Storage and unexpected errors never leak internals.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidSectionException.class)
    ResponseEntity<ApiError> handleInvalidSection(InvalidSectionException ex) {
        LOG.warn("Invalid section '{}' for framework {}", ex.getSectionName(), ex.getFrameworkName());
        return badRequest(ex, "Invalid section name", "section_name", ex.getValidSections());
    }

    @ExceptionHandler(QuestionIndexOutOfRangeException.class)
    ResponseEntity<ApiError> handleQuestionIndex(QuestionIndexOutOfRangeException ex) {
        LOG.warn("Question index {} out of range (count={})", ex.getQuestionIndex(), ex.getQuestionCount());
        return badRequest(ex, "Question index out of range", "question_index", null);
    }

    @ExceptionHandler(EmptyAnswerException.class)
    ResponseEntity<ApiError> handleEmptyAnswer(EmptyAnswerException ex) {
        LOG.warn("Empty answer: practice={}, question={}", ex.getPracticeId(), ex.getQuestionIndex());
        return badRequest(ex, "Answer is empty", "answer_text", null);
    }

    @ExceptionHandler(InvalidAnalysisRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidAnalysisRequestException ex) {
        LOG.warn("Invalid request field '{}': {}", ex.getField(), ex.getMessage());
        List<String> acceptable = ex.getAcceptableValues().isEmpty() ? null : ex.getAcceptableValues();
        return badRequest(ex, "Invalid request", ex.getField(), acceptable);
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return badRequest(ex, "Invalid audio", "audio", null);
    }

    @ExceptionHandler(InvalidTimeSpentException.class)
    ResponseEntity<ApiError> handleInvalidTimeSpent(InvalidTimeSpentException ex) {
        LOG.warn("Negative time spent: {}", ex.getTimeSpentSeconds());
        return badRequest(ex, "Invalid time spent", "time_spent_seconds", null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Audio upload too large",
                "Maximum upload size is " + ex.getMaxUploadSize() + " bytes",
                "audio",
                null,
                Instant.now()
            ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleBodyValidation(MethodArgumentNotValidException ex) {
        List<FieldError> errors = ex.getBindingResult().getFieldErrors();
        String field = errors.isEmpty() ? null : toSnakeCase(errors.get(0).getField());
        String details = errors.stream()
            .map(e -> toSnakeCase(e.getField()) + " " + e.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request body validation failed: {}", details);
        return ResponseEntity
            .badRequest()
            .body(new ApiError("ValidationException", "Invalid request body", details, field, null, Instant.now()));
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MissingServletRequestPartException.class,
        MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        String field = null;
        if (ex instanceof MissingServletRequestParameterException missing) {
            field = missing.getParameterName();
        } else if (ex instanceof MissingServletRequestPartException missing) {
            field = missing.getRequestPartName();
        } else if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            field = mismatch.getName();
        }
        String details = ex instanceof HttpMessageNotReadableException
            ? "Request body is missing or is not valid JSON"
            : ex.getMessage();
        return ResponseEntity
            .badRequest()
            .body(new ApiError(ex.getClass().getSimpleName(), "Malformed request", details, field, null, Instant.now()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        LOG.warn("Unsupported content type: {}", ex.getContentType());
        List<String> supported = ex.getSupportedMediaTypes().stream().map(MediaType::toString).toList();
        return ResponseEntity
            .status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
            .body(new ApiError(ex.getClass().getSimpleName(), "Unsupported content type",
                "Send the request body as " + String.join(" or ", supported), "Content-Type",
                supported.isEmpty() ? null : supported, Instant.now()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException ex) {
        LOG.info("{} {} not found", ex.getResourceType(), ex.getResourceId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(ex.getClass().getSimpleName(), ex.getResourceType() + " not found",
                ex.getMessage(), null, null, Instant.now()));
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    ResponseEntity<ApiError> handleNoRoute(Exception ex) {
        HttpStatus status = ex instanceof HttpRequestMethodNotSupportedException
            ? HttpStatus.METHOD_NOT_ALLOWED
            : HttpStatus.NOT_FOUND;
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), status.getReasonPhrase(), ex.getMessage(),
                null, null, Instant.now()));
    }

    @ExceptionHandler(ReportSynthesisException.class)
    ResponseEntity<ApiError> handleReportSynthesis(ReportSynthesisException ex) {
        LOG.warn("Report synthesis rejected for interview {}: {}", ex.getInterviewId(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(ex.getClass().getSimpleName(), "Report cannot be generated",
                ex.getMessage(), null, null, Instant.now()));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Transcription failed: model={}", ex.getModelIdentifier(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable",
                "Please retry in a few seconds",
                null,
                null,
                Instant.now()
            ));
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    ResponseEntity<ApiError> handleCollaborator(CollaboratorUnavailableException ex) {
        LOG.error("Collaborator {} unavailable", ex.getCollaborator(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(ex.getClass().getSimpleName(), "Dependent service temporarily unavailable",
                "Please retry in a few seconds", null, null, Instant.now()));
    }

    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOG.error("Storage operation '{}' failed", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("StorageError", "Storage operation failed",
                "Please retry; contact support with request ID if it persists", null, null, Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                null,
                null,
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(RuntimeException ex, String message,
                                                       String field, List<String> acceptableValues) {
        return ResponseEntity
            .badRequest()
            .body(new ApiError(ex.getClass().getSimpleName(), message, ex.getMessage(), field,
                acceptableValues, Instant.now()));
    }

    static String toSnakeCase(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }

    /**
     * Standardized error response for API clients. {@code field} and {@code acceptableValues}
     * are omitted when they do not apply.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ApiError(
        String errorCode,
        String message,
        String details,
        String field,
        List<String> acceptableValues,
        Instant timestamp
    ) {}
}
