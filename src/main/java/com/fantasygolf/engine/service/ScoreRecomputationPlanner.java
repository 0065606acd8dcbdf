package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.RecomputeOptions;
import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.RawScoreSource;
import com.fantasygolf.engine.model.RecomputationPlan;
import com.fantasygolf.engine.model.RecomputationSummary;
import com.fantasygolf.engine.model.RecomputedScore;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.model.ScoreRecord;
import com.fantasygolf.engine.model.ScoringFormat;
import com.fantasygolf.engine.model.SourceResultRow;
import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.model.TournamentResult;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Re-derives every stored breakdown under the current scoring rules.
 *
 * <p>Raw scores are resolved per record in this order: a new-format source row joined
 * by tournament date and normalized golfer name; a numeric raw score already on the
 * record; the legacy boolean flag mapped through the fallback policy; and finally the
 * absent-flag policy. Pure: the same snapshot always yields the same plan.
 */
@Component
public class ScoreRecomputationPlanner {

    private final ScoringCalculator scoringCalculator;
    private final RecomputeOptions options;

    public ScoreRecomputationPlanner(ScoringCalculator scoringCalculator, RecomputeOptions options) {
        this.scoringCalculator = scoringCalculator;
        this.options = options;
    }

    public RecomputationPlan plan(List<ScoreRecord> scores,
                                  Map<String, Tournament> tournaments,
                                  Map<String, Golfer> golfers,
                                  List<SourceResultRow> sourceRows,
                                  RunMode mode) {
        Map<String, SourceResultRow> sourceIndex = new HashMap<>();
        int duplicates = indexSourceRows(sourceRows, sourceIndex);

        RecomputationSummary summary = RecomputationSummary.builder()
            .mode(mode)
            .duplicateSourceRows(duplicates)
            .build();
        Set<String> tournamentsTouched = new HashSet<>();
        List<RecomputedScore> recomputed = new ArrayList<>();

        for (ScoreRecord record : scores) {
            Tournament tournament = tournaments.get(record.getTournamentId());
            if (tournament == null) {
                summary.setOrphanedRecords(summary.getOrphanedRecords() + 1);
                continue;
            }
            tournamentsTouched.add(tournament.getTournamentId());

            RecomputedScore score = recompute(record, tournament, golfers.get(record.getGolferId()), sourceIndex);
            count(summary, score);
            summary.setPointsBefore(summary.getPointsBefore() + score.getBefore().getMultipliedPoints());
            summary.setPointsAfter(summary.getPointsAfter() + score.getAfter().getMultipliedPoints());
            recomputed.add(score);
        }
        summary.setTournaments(tournamentsTouched.size());

        return RecomputationPlan.builder()
            .scores(recomputed)
            .summary(summary)
            .build();
    }

    private RecomputedScore recompute(ScoreRecord record, Tournament tournament, Golfer golfer,
                                      Map<String, SourceResultRow> sourceIndex) {
        ScoringFormat format = tournament.effectiveScoringFormat();
        PointBreakdown before = record.toBreakdown();
        RecomputedScore.RecomputedScoreBuilder builder = RecomputedScore.builder()
            .scoreId(record.getScoreId())
            .tournamentId(record.getTournamentId())
            .golferId(record.getGolferId())
            .previousRawScore(record.getRawScore())
            .before(before);

        if (!record.isParticipated()) {
            PointBreakdown after = scoringCalculator.rescore(toResult(record, tournament, record.getRawScore()));
            return builder.source(RawScoreSource.NOT_PARTICIPATED)
                .rawScore(record.getRawScore())
                .after(after)
                .build();
        }

        SourceResultRow match = findMatch(tournament, golfer, sourceIndex);
        RawScoreSource source;
        Double rawScore;
        if (match != null) {
            source = RawScoreSource.MATCHED;
            rawScore = match.getRawScore();
            builder.legacyFlagCleared(record.getScored36Plus() != null);
        } else if (record.getRawScore() != null) {
            source = RawScoreSource.RETAINED;
            rawScore = record.getRawScore();
        } else if (Boolean.TRUE.equals(record.getScored36Plus())) {
            source = RawScoreSource.FALLBACK_FLAG_TRUE;
            rawScore = legacyFlagValue(format);
        } else if (Boolean.FALSE.equals(record.getScored36Plus())) {
            source = RawScoreSource.FALLBACK_NO_BONUS;
            rawScore = null;
        } else if (options.getAbsentFlagPolicy() == RecomputeOptions.AbsentFlagPolicy.EXCLUDE) {
            return builder.source(RawScoreSource.EXCLUDED)
                .rawScore(record.getRawScore())
                .after(before)
                .build();
        } else {
            source = RawScoreSource.FALLBACK_NO_BONUS;
            rawScore = null;
        }

        PointBreakdown after = scoringCalculator.rescore(toResult(record, tournament, rawScore));
        return builder.source(source)
            .rawScore(rawScore)
            .after(after)
            .build();
    }

    private Double legacyFlagValue(ScoringFormat format) {
        if (options.getLegacyFlagMapping() == RecomputeOptions.LegacyFlagMapping.LEGACY_THRESHOLD) {
            return scoringCalculator.getRules().topBonusTierFloor(format);
        }
        return scoringCalculator.getRules().lowestBonusTierFloor(format);
    }

    private SourceResultRow findMatch(Tournament tournament, Golfer golfer, Map<String, SourceResultRow> sourceIndex) {
        if (golfer == null || tournament.getStartDate() == null) {
            return null;
        }
        return sourceIndex.get(matchKey(tournament.getStartDate(), golfer.getDisplayName()));
    }

    // First row wins; returns the number of later rows dropped as duplicates
    private int indexSourceRows(List<SourceResultRow> sourceRows, Map<String, SourceResultRow> index) {
        if (sourceRows == null) {
            return 0;
        }
        int duplicates = 0;
        for (SourceResultRow row : sourceRows) {
            if (row.getDate() == null || row.getPlayerName() == null) {
                continue;
            }
            if (index.putIfAbsent(matchKey(row.getDate(), row.getPlayerName()), row) != null) {
                duplicates++;
            }
        }
        return duplicates;
    }

    private void count(RecomputationSummary summary, RecomputedScore score) {
        switch (score.getSource()) {
            case MATCHED:
                summary.setMatchedRows(summary.getMatchedRows() + 1);
                break;
            case FALLBACK_FLAG_TRUE:
                summary.setUnmatchedRows(summary.getUnmatchedRows() + 1);
                summary.setFallbackRows(summary.getFallbackRows() + 1);
                summary.setFallbackFlagTrueRows(summary.getFallbackFlagTrueRows() + 1);
                break;
            case FALLBACK_NO_BONUS:
                summary.setUnmatchedRows(summary.getUnmatchedRows() + 1);
                summary.setFallbackRows(summary.getFallbackRows() + 1);
                summary.setFallbackNoBonusRows(summary.getFallbackNoBonusRows() + 1);
                break;
            case RETAINED:
                summary.setUnmatchedRows(summary.getUnmatchedRows() + 1);
                summary.setRetainedRows(summary.getRetainedRows() + 1);
                break;
            case EXCLUDED:
                summary.setUnmatchedRows(summary.getUnmatchedRows() + 1);
                summary.setRecordsExcluded(summary.getRecordsExcluded() + 1);
                return;
            default:
                break;
        }
        summary.setRecordsRecalculated(summary.getRecordsRecalculated() + 1);
        if (score.isChanged()) {
            summary.setRecordsChanged(summary.getRecordsChanged() + 1);
        }
    }

    static TournamentResult toResult(ScoreRecord record, Tournament tournament, Double rawScore) {
        return TournamentResult.builder()
            .golferId(record.getGolferId())
            .tournamentId(record.getTournamentId())
            .participated(record.isParticipated())
            .position(record.getPosition())
            .rawPerformanceScore(rawScore)
            .scoringFormat(tournament.effectiveScoringFormat())
            .multiplier(tournament.effectiveMultiplier())
            .build();
    }

    static String matchKey(LocalDate date, String playerName) {
        return date + "|" + normalizeName(playerName);
    }

    /**
     * Lower-cased, accent-free, punctuation-free, single-spaced name.
     */
    static String normalizeName(String name) {
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9 ]", " ")
            .trim()
            .replaceAll("\\s+", " ");
    }
}
