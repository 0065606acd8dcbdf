package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.Golfer;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GolferJpaRepository extends JpaRepository<Golfer, String> {
    List<Golfer> findAllByOrderByPriceDescGolferIdAsc(Pageable pageable);
}
