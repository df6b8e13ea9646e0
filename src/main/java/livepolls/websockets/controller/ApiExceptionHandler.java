package livepolls.websockets.controller;

import livepolls.websockets.dto.ApiResponse;
import livepolls.websockets.exception.BackendUnavailableException;
import livepolls.websockets.exception.InvalidPollException;
import livepolls.websockets.exception.OptionNotFoundException;
import livepolls.websockets.exception.PollClosedException;
import livepolls.websockets.exception.PollNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps failures to the response envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PollNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(PollNotFoundException e) {
        log.debug("Poll not found: {}", e.getPollId());
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(PollClosedException.class)
    public ResponseEntity<ApiResponse<Void>> handleClosed(PollClosedException e) {
        log.debug("Rejected change to closed poll: {}", e.getPollId());
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(OptionNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnknownOption(OptionNotFoundException e) {
        log.debug("Unknown option '{}' for poll {}", e.getOption(), e.getPollId());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(InvalidPollException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidPoll(InvalidPollException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .distinct()
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnavailable(BackendUnavailableException e) {
        log.warn("Backend unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        // Framework errors such as unknown routes or wrong methods keep their own status
        if (e instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return respond(status, status.getReasonPhrase());
            }
        }
        log.error("Unhandled error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(message));
    }
}
