package ai.imagegraph.executor.controller;

import ai.imagegraph.executor.dto.ErrorResponse;
import ai.imagegraph.executor.exception.BackendNetworkException;
import ai.imagegraph.executor.exception.ImageStorageException;
import ai.imagegraph.executor.exception.JobExecutionException;
import ai.imagegraph.workflow.exception.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(TemplateException.class)
    public ResponseEntity<ErrorResponse> handleTemplate(TemplateException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(BackendNetworkException.class)
    public ResponseEntity<ErrorResponse> handleBackend(BackendNetworkException e) {
        return error(HttpStatus.BAD_GATEWAY, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(JobExecutionException.class)
    public ResponseEntity<ErrorResponse> handleJob(JobExecutionException e) {
        HttpStatus status = e.getReason() == JobExecutionException.Reason.TIMED_OUT
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        return error(status, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(ImageStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(ImageStorageException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getReason().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, HttpStatus.BAD_REQUEST.name(), message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, HttpStatus.BAD_REQUEST.name(), e.getMessage());
    }

    /**
     * Argument and state errors that escape past request validation.
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleInternal(RuntimeException e) {
        logger.error("Unhandled internal error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, e.getMessage());
    }

    private static String describe(FieldError fieldError) {
        return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.name(), reason, message));
    }
}
