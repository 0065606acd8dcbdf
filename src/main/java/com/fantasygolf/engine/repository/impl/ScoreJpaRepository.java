package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.ScoreRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScoreJpaRepository extends JpaRepository<ScoreRecord, String> {
    List<ScoreRecord> findByGolferId(String golferId);
}
