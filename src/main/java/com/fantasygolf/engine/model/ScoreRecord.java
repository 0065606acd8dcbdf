package com.fantasygolf.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored result of one golfer in one tournament, with its derived breakdown.
 * {@code scored36Plus} is the legacy boolean bonus flag; null when never recorded.
 */
@Entity
@Table(name = "scores", indexes = {
    @Index(name = "idx_score_tournament", columnList = "tournament_id"),
    @Index(name = "idx_score_golfer", columnList = "golfer_id"),
    @Index(name = "idx_score_tournament_golfer", columnList = "tournament_id,golfer_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRecord {
    @Id
    @Column(name = "score_id")
    private String scoreId;
    
    @Column(name = "tournament_id", nullable = false)
    private String tournamentId;
    
    @Column(name = "golfer_id", nullable = false)
    private String golferId;
    
    @Column(name = "participated", nullable = false)
    private boolean participated;
    
    @Column(name = "position")
    private Integer position;
    
    @Column(name = "raw_score")
    private Double rawScore;
    
    @Column(name = "scored_36_plus")
    private Boolean scored36Plus;
    
    @Column(name = "base_points", nullable = false)
    private int basePoints;
    
    @Column(name = "bonus_points", nullable = false)
    private int bonusPoints;
    
    @Column(name = "multiplied_points", nullable = false)
    private double multipliedPoints;
    
    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public PointBreakdown toBreakdown() {
        return new PointBreakdown(basePoints, bonusPoints, multipliedPoints);
    }

    public void applyBreakdown(PointBreakdown breakdown) {
        this.basePoints = breakdown.getBasePoints();
        this.bonusPoints = breakdown.getBonusPoints();
        this.multipliedPoints = breakdown.getMultipliedPoints();
    }
}
