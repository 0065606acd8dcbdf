package com.fantasygolf.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * New-format per-event fact supplied for a recomputation: who played on which date
 * and their numeric raw score. Joined to stored scores by date and player name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResultRow {
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate date;
    private String playerName;
    private Integer position;
    private Double rawScore;
}
