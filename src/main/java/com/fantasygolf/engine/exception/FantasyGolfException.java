package com.fantasygolf.engine.exception;

public class FantasyGolfException extends RuntimeException {
    private final String errorCode;
    
    public FantasyGolfException(String message) {
        super(message);
        this.errorCode = "ENGINE_ERROR";
    }
    
    public FantasyGolfException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public FantasyGolfException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "ENGINE_ERROR";
    }
    
    public FantasyGolfException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
