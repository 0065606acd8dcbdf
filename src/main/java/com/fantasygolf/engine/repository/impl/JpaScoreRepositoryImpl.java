package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.ScoreRecord;
import com.fantasygolf.engine.repository.ScoreRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JpaScoreRepositoryImpl implements ScoreRepository {
    
    private final ScoreJpaRepository jpaRepository;
    
    @Autowired
    public JpaScoreRepositoryImpl(ScoreJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public ScoreRecord save(ScoreRecord scoreRecord) {
        return jpaRepository.save(scoreRecord);
    }
    
    @Override
    public List<ScoreRecord> findAll() {
        return jpaRepository.findAll();
    }
    
    @Override
    public List<ScoreRecord> findByGolferId(String golferId) {
        return jpaRepository.findByGolferId(golferId);
    }
}
