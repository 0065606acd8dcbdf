package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.TeamRoster;

import java.util.List;

public interface TeamRosterRepository {
    List<TeamRoster> findAll();
}
