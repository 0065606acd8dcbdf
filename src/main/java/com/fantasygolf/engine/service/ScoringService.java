package com.fantasygolf.engine.service;

import com.fantasygolf.engine.dto.ScoreEntryRequest;
import com.fantasygolf.engine.exception.TournamentNotFoundException;
import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.model.TournamentResult;
import com.fantasygolf.engine.repository.TournamentRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Scores a single entered result against its tournament's format and multiplier.
 */
@Service
public class ScoringService {

    private final ScoringCalculator scoringCalculator;
    private final TournamentRepository tournamentRepository;

    @Autowired
    public ScoringService(ScoringCalculator scoringCalculator, TournamentRepository tournamentRepository) {
        this.scoringCalculator = scoringCalculator;
        this.tournamentRepository = tournamentRepository;
    }

    public PointBreakdown breakdownFor(ScoreEntryRequest request) {
        if (request == null) {
            throw new ValidationException("request", "must not be null");
        }
        Tournament tournament = tournamentRepository.findById(request.getTournamentId())
            .orElseThrow(() -> new TournamentNotFoundException(
                "Tournament not found with id: " + request.getTournamentId()));

        TournamentResult result = TournamentResult.builder()
            .golferId(request.getGolferId())
            .tournamentId(tournament.getTournamentId())
            .participated(Boolean.TRUE.equals(request.getParticipated()))
            .position(request.getPosition())
            .rawPerformanceScore(request.getRawScore())
            .scoringFormat(tournament.effectiveScoringFormat())
            .multiplier(tournament.effectiveMultiplier())
            .build();
        return scoringCalculator.calculate(result);
    }
}
