package com.syncbridge.api.rest;

import com.syncbridge.core.exception.InvalidStateTransitionException;
import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.exception.NotFoundException;
import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.exception.PublishFailedException;
import com.syncbridge.core.exception.SyncBridgeException;
import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.exception.UnknownEventReferenceException;
import com.syncbridge.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps sync errors to {@code {errorCode, message}} responses.
 *
 * <ul>
 *   <li>404: unknown event, workflow or workflow type</li>
 *   <li>409: state conflicts (terminal event republished, workflow not RUNNING, concurrent update)</li>
 *   <li>400: malformed requests and payloads</li>
 *   <li>503: the stream or a store stayed unavailable; the request may be repeated</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, OptimisticLockException.class})
    public ResponseEntity<ErrorResponse> handleConflict(SyncBridgeException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({MalformedMessageException.class, WorkflowValidationException.class,
        UnknownEventReferenceException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(SyncBridgeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(INVALID_REQUEST, e.getMessage()));
    }

    @ExceptionHandler({PublishFailedException.class, TransientIOException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(SyncBridgeException e) {
        log.warn("Dependency unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(SyncBridgeException.class)
    public ResponseEntity<ErrorResponse> handleOther(SyncBridgeException e) {
        log.error("Unhandled sync error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, SyncBridgeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
