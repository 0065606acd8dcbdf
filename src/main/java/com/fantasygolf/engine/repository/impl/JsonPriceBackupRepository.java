package com.fantasygolf.engine.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.repository.PriceBackupRepository;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Writes a pretty-printed JSON snapshot of golfer prices, one file per backup.
 */
@Repository
public class JsonPriceBackupRepository implements PriceBackupRepository {
    
    private final String backupDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public JsonPriceBackupRepository(
            @Value("${fantasy.pricing.backup-directory:./data/price-backups}") String backupDirectory) {
        this(backupDirectory, Clock.systemUTC());
    }
    
    JsonPriceBackupRepository(String backupDirectory, Clock clock) {
        this.backupDirectory = backupDirectory;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }
    
    @Override
    public Path backup(List<Golfer> golfers) throws IOException {
        Path directory = Paths.get(backupDirectory);
        if (!Files.exists(directory)) {
            Files.createDirectories(directory);
        }
        
        List<PriceBackupEntry> entries = golfers.stream()
            .sorted(Comparator.comparing(Golfer::getGolferId))
            .map(golfer -> new PriceBackupEntry(golfer.getGolferId(), golfer.getDisplayName(), golfer.getPrice()))
            .toList();
        
        Path file = directory.resolve("pricing-backup-" + clock.millis() + ".json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
        return file;
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class PriceBackupEntry {
        private String id;
        private String name;
        private Long price;
    }
}
