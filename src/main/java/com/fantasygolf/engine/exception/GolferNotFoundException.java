package com.fantasygolf.engine.exception;

public class GolferNotFoundException extends FantasyGolfException {
    public GolferNotFoundException(String message) {
        super(message, "GOLFER_NOT_FOUND");
    }
}
