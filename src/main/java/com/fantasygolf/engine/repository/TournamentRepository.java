package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.Tournament;

import java.util.List;
import java.util.Optional;

public interface TournamentRepository {
    Optional<Tournament> findById(String tournamentId);
    List<Tournament> findAll();
}
