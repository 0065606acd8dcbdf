package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.TeamRoster;
import com.fantasygolf.engine.repository.TeamRosterRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JpaTeamRosterRepositoryImpl implements TeamRosterRepository {
    
    private final TeamRosterJpaRepository jpaRepository;
    
    @Autowired
    public JpaTeamRosterRepositoryImpl(TeamRosterJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public List<TeamRoster> findAll() {
        return jpaRepository.findAll();
    }
}
