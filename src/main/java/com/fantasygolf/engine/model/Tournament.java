package com.fantasygolf.engine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Entity
@Table(name = "tournaments", indexes = {
    @Index(name = "idx_tournament_season", columnList = "season"),
    @Index(name = "idx_tournament_start_date", columnList = "start_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tournament {
    @Id
    @Column(name = "tournament_id")
    private String tournamentId;
    
    @Column(name = "name")
    private String name;
    
    @Column(name = "start_date")
    private LocalDate startDate;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "tournament_type")
    private TournamentType tournamentType;
    
    @Column(name = "multiplier")
    private Double multiplier;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_format")
    private ScoringFormat scoringFormat;
    
    @Column(name = "season")
    private Integer season;

    /**
     * Stored multiplier, or the tournament type's default when none was recorded.
     */
    public double effectiveMultiplier() {
        if (multiplier != null) {
            return multiplier;
        }
        return tournamentType != null ? tournamentType.getDefaultMultiplier() : TournamentType.REGULAR.getDefaultMultiplier();
    }

    // Tournaments that predate scoring formats were all stableford
    public ScoringFormat effectiveScoringFormat() {
        return scoringFormat != null ? scoringFormat : ScoringFormat.STABLEFORD;
    }
}
