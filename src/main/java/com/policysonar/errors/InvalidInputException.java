package com.policysonar.errors;

/**
 * Raised when a caller hands the engine input it cannot work with:
 * blank query text, a threshold outside [0, 1], a record without id or text.
 * An empty corpus is not invalid input.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
