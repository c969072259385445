package com.hypecycle.core.model;

/**
 * Thrown when a keyword is empty or too long after trimming.
 */
public class InvalidKeywordException extends IllegalArgumentException {

    public InvalidKeywordException(String message) {
        super(message);
    }
}
