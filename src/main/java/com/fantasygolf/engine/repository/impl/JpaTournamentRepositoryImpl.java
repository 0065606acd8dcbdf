package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.repository.TournamentRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaTournamentRepositoryImpl implements TournamentRepository {
    
    private final TournamentJpaRepository jpaRepository;
    
    @Autowired
    public JpaTournamentRepositoryImpl(TournamentJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Optional<Tournament> findById(String tournamentId) {
        return jpaRepository.findById(tournamentId);
    }
    
    @Override
    public List<Tournament> findAll() {
        return jpaRepository.findAll();
    }
}
