package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.Golfer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface PriceBackupRepository {
    /**
     * Writes the golfers' current prices to a new backup and returns where it went.
     */
    Path backup(List<Golfer> golfers) throws IOException;
}
