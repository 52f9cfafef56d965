package com.phillippitts.wordcomplexity.exception;

/**
 * Base exception for all word-complexity errors.
 * All domain exceptions extend this class so callers can isolate failures per word.
 */
public class WordComplexityException extends RuntimeException {

    public WordComplexityException(String message) {
        super(message);
    }

    public WordComplexityException(String message, Throwable cause) {
        super(message, cause);
    }
}
