package com.fantasygolf.engine.exception;

public class TournamentNotFoundException extends FantasyGolfException {
    public TournamentNotFoundException(String message) {
        super(message, "TOURNAMENT_NOT_FOUND");
    }
}
