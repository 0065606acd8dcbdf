package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.TeamRoster;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TeamRosterJpaRepository extends JpaRepository<TeamRoster, String> {
}
