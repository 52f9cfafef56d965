package com.phillippitts.wordcomplexity.presentation.exception;

import com.phillippitts.wordcomplexity.exception.ConservationViolationException;
import com.phillippitts.wordcomplexity.exception.IllegalClusterException;
import com.phillippitts.wordcomplexity.exception.NoNucleusFoundException;
import com.phillippitts.wordcomplexity.exception.UnknownPhonemeException;
import com.phillippitts.wordcomplexity.exception.WordNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses: dictionary misses are 404, input the
 * engine cannot syllabify is 422, a conservation violation is a server defect (500).
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WordNotFoundException.class)
    ResponseEntity<ApiError> handleWordNotFound(WordNotFoundException ex) {
        LOG.info("Word not found: {}", ex.getWord());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Word not in pronunciation dictionary", ex.getMessage());
    }

    @ExceptionHandler(UnknownPhonemeException.class)
    ResponseEntity<ApiError> handleUnknownPhoneme(UnknownPhonemeException ex) {
        LOG.warn("Unknown phoneme: symbol={}, reason={}", ex.getSymbol(), ex.getReason());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Invalid ARPAbet symbol", ex.getMessage());
    }

    @ExceptionHandler(NoNucleusFoundException.class)
    ResponseEntity<ApiError> handleNoNucleus(NoNucleusFoundException ex) {
        LOG.warn("No nucleus in {}", ex.getPhonemes());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Pronunciation has no vowel", ex.getMessage());
    }

    @ExceptionHandler(IllegalClusterException.class)
    ResponseEntity<ApiError> handleIllegalCluster(IllegalClusterException ex) {
        LOG.warn("Illegal cluster {} between {} and {}",
                ex.getCluster(), ex.getPrecedingNucleus(), ex.getFollowingNucleus());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Consonant cluster cannot be syllabified", ex.getMessage());
    }

    /**
     * Engine defect - never caused by the client (HTTP 500).
     */
    @ExceptionHandler(ConservationViolationException.class)
    ResponseEntity<ApiError> handleConservationViolation(ConservationViolationException ex) {
        LOG.error("Conservation violated: expected={}, actual={}", ex.getExpected(), ex.getActual(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Syllabification failed its integrity check", "Please report this pronunciation");
    }

    /**
     * Client error - invalid request (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid request", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
