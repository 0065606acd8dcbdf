package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.Golfer;

import java.util.List;
import java.util.Optional;

public interface GolferRepository {
    Golfer save(Golfer golfer);
    Optional<Golfer> findById(String golferId);
    List<Golfer> findAll();
    List<Golfer> findTopByPrice(int limit);
}
