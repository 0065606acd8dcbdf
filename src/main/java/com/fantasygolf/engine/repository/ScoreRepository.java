package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.ScoreRecord;

import java.util.List;

public interface ScoreRepository {
    ScoreRecord save(ScoreRecord scoreRecord);
    List<ScoreRecord> findAll();
    List<ScoreRecord> findByGolferId(String golferId);
}
