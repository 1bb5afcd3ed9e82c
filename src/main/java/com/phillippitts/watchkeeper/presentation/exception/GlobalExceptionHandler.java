package com.phillippitts.watchkeeper.presentation.exception;

import com.phillippitts.watchkeeper.exception.GateBusyException;
import com.phillippitts.watchkeeper.exception.SpawnException;
import com.phillippitts.watchkeeper.exception.UnknownWatcherException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts supervisor exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "1";

    /**
     * Another command holds the gate - retry possible (HTTP 503).
     */
    @ExceptionHandler(GateBusyException.class)
    ResponseEntity<ApiError> handleGateBusy(GateBusyException ex) {
        LOG.info("Command '{}' refused: '{}' in progress", ex.getRequestedCommand(), ex.getActiveCommand());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Supervisor busy",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - no such watcher (HTTP 404).
     */
    @ExceptionHandler(UnknownWatcherException.class)
    ResponseEntity<ApiError> handleUnknownWatcher(UnknownWatcherException ex) {
        LOG.warn(ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unknown watcher",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid scale, duplicate name or bad watcher definition (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected command: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid command",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Spawn failure that escaped a single-watcher command (HTTP 500).
     */
    @ExceptionHandler(SpawnException.class)
    ResponseEntity<ApiError> handleSpawnFailure(SpawnException ex) {
        LOG.error("Spawn failed: watcher={}", ex.getWatcherName(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Process could not be started",
                ex.getMessage(),
                Instant.now()
            ));
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
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
