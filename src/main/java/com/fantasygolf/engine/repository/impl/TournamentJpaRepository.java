package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.Tournament;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TournamentJpaRepository extends JpaRepository<Tournament, String> {
}
