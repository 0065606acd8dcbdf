package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.repository.GolferRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaGolferRepositoryImpl implements GolferRepository {
    
    private final GolferJpaRepository jpaRepository;
    
    @Autowired
    public JpaGolferRepositoryImpl(GolferJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public Golfer save(Golfer golfer) {
        return jpaRepository.save(golfer);
    }
    
    @Override
    public Optional<Golfer> findById(String golferId) {
        return jpaRepository.findById(golferId);
    }
    
    @Override
    public List<Golfer> findAll() {
        return jpaRepository.findAll();
    }
    
    @Override
    public List<Golfer> findTopByPrice(int limit) {
        return jpaRepository.findAllByOrderByPriceDescGolferIdAsc(PageRequest.of(0, limit));
    }
}
