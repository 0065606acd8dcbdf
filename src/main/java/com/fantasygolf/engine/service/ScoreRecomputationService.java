package com.fantasygolf.engine.service;

import com.fantasygolf.engine.exception.PersistenceException;
import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.model.RawScoreSource;
import com.fantasygolf.engine.model.RecomputationPlan;
import com.fantasygolf.engine.model.RecomputationSummary;
import com.fantasygolf.engine.model.RecomputedScore;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.model.ScoreRecord;
import com.fantasygolf.engine.model.SourceResultRow;
import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.repository.GolferRepository;
import com.fantasygolf.engine.repository.ScoreRepository;
import com.fantasygolf.engine.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Batch re-derivation of every stored breakdown after a scoring-formula change.
 * Preview and apply run the same plan; apply then saves each changed record on its own.
 * Re-running apply on unchanged data writes nothing.
 */
@Service
public class ScoreRecomputationService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreRecomputationService.class);

    private final ScoreRecomputationPlanner planner;
    private final ScoreRepository scoreRepository;
    private final TournamentRepository tournamentRepository;
    private final GolferRepository golferRepository;

    @Autowired
    public ScoreRecomputationService(
            ScoreRecomputationPlanner planner,
            ScoreRepository scoreRepository,
            TournamentRepository tournamentRepository,
            GolferRepository golferRepository) {
        this.planner = planner;
        this.scoreRepository = scoreRepository;
        this.tournamentRepository = tournamentRepository;
        this.golferRepository = golferRepository;
    }

    public RecomputationSummary recompute(RunMode mode, List<SourceResultRow> sourceRows) {
        logger.info("Starting score recomputation - mode: {}, source rows: {}",
            mode, sourceRows != null ? sourceRows.size() : 0);

        List<ScoreRecord> scores;
        Map<String, Tournament> tournaments;
        Map<String, Golfer> golfers;
        try {
            scores = scoreRepository.findAll();
            tournaments = tournamentRepository.findAll().stream()
                .collect(Collectors.toMap(Tournament::getTournamentId, Function.identity(), (a, b) -> a));
            golfers = golferRepository.findAll().stream()
                .collect(Collectors.toMap(Golfer::getGolferId, Function.identity(), (a, b) -> a));
        } catch (RuntimeException e) {
            logger.error("Failed to load recomputation snapshot", e);
            throw new PersistenceException("Failed to load recomputation snapshot: " + e.getMessage(), e);
        }

        RecomputationPlan plan = planner.plan(scores, tournaments, golfers, sourceRows, mode);
        RecomputationSummary summary = plan.getSummary();
        logSummary(summary);

        if (mode == RunMode.APPLY) {
            Map<String, ScoreRecord> recordsById = scores.stream()
                .collect(Collectors.toMap(ScoreRecord::getScoreId, Function.identity(), (a, b) -> a));
            summary.setRecordsWritten(apply(plan, recordsById));
        } else {
            logger.info("Preview complete - no scores written");
        }
        return summary;
    }

    private int apply(RecomputationPlan plan, Map<String, ScoreRecord> recordsById) {
        int written = 0;
        Instant now = Instant.now();
        for (RecomputedScore score : plan.getScores()) {
            if (!score.needsWrite()) {
                continue;
            }
            ScoreRecord record = recordsById.get(score.getScoreId());
            record.setRawScore(score.getRawScore());
            if (score.isLegacyFlagCleared()) {
                record.setScored36Plus(null);
            }
            record.applyBreakdown(score.getAfter());
            record.setUpdatedAt(now);
            try {
                scoreRepository.save(record);
                written++;
            } catch (Exception e) {
                logger.error("Failed to write score {} after {} records written; re-run apply to finish",
                    score.getScoreId(), written, e);
                throw new PersistenceException("Failed to write score " + score.getScoreId(), e);
            }
        }
        logger.info("Wrote {} recomputed scores", written);
        return written;
    }

    private void logSummary(RecomputationSummary summary) {
        logger.info("Recalculated {} scores across {} tournaments ({} changed)",
            summary.getRecordsRecalculated(), summary.getTournaments(), summary.getRecordsChanged());
        logger.info("Source matching - matched: {}, unmatched: {}, retained numeric: {}",
            summary.getMatchedRows(), summary.getUnmatchedRows(), summary.getRetainedRows());

        if (summary.getFallbackRows() > 0) {
            logger.warn("Fallback applied to {} unmatched rows - {} {} to bonus floor, {} {} to no bonus",
                summary.getFallbackRows(),
                summary.getFallbackFlagTrueRows(), RawScoreSource.FALLBACK_FLAG_TRUE,
                summary.getFallbackNoBonusRows(), RawScoreSource.FALLBACK_NO_BONUS);
        }
        if (summary.getRecordsExcluded() > 0) {
            logger.warn("Excluded {} records with no legacy flag and no source row", summary.getRecordsExcluded());
        }
        if (summary.getDuplicateSourceRows() > 0) {
            logger.warn("Ignored {} duplicate source rows (same date and player)", summary.getDuplicateSourceRows());
        }
        if (summary.getOrphanedRecords() > 0) {
            logger.warn("Skipped {} scores referencing unknown tournaments", summary.getOrphanedRecords());
        }
        logger.info("Total points before: {}, after: {}, drift: {}",
            summary.getPointsBefore(), summary.getPointsAfter(), summary.getPointDrift());
    }
}
