package com.fantasygolf.engine.exception;

/**
 * Raised when an input violates the scoring or pricing contract.
 * Carries the name of the offending field so callers can report it.
 */
public class ValidationException extends FantasyGolfException {
    private final String field;
    
    public ValidationException(String field, String message) {
        super(field + ": " + message, "VALIDATION_ERROR");
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
