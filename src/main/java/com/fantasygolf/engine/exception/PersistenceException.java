package com.fantasygolf.engine.exception;

/**
 * Storage failure during a batch run. Fatal for the run.
 */
public class PersistenceException extends FantasyGolfException {
    public PersistenceException(String message, Throwable cause) {
        super(message, "PERSISTENCE_ERROR", cause);
    }
}
