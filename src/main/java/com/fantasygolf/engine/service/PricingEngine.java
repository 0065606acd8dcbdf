package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.PricingConfig;
import com.fantasygolf.engine.model.GolferHistory;
import com.fantasygolf.engine.model.GolferPerformanceProfile;
import com.fantasygolf.engine.model.NormalizationBasis;
import com.fantasygolf.engine.model.OverBudgetRoster;
import com.fantasygolf.engine.model.PriceChange;
import com.fantasygolf.engine.model.PriceTier;
import com.fantasygolf.engine.model.PricingReport;
import com.fantasygolf.engine.model.PricingResult;
import com.fantasygolf.engine.model.RankInversion;
import com.fantasygolf.engine.model.ScoredResult;
import com.fantasygolf.engine.model.TeamRoster;
import com.fantasygolf.engine.model.TournamentResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns every golfer's scored history into a bounded price.
 *
 * <p>Each run rebuilds the performance profiles from scratch, normalizes them onto
 * [0, 1] (by composite score or by current price position), maps the normalized value
 * through a power curve between the floor and ceiling price, and audits the outcome
 * for rank inversions and over-budget rosters. Nothing is written; the caller decides
 * what to do with the {@link PricingResult}.
 */
@Component
public class PricingEngine {

    private final ScoringCalculator scoringCalculator;
    private final PricingConfig config;

    public PricingEngine(ScoringCalculator scoringCalculator, PricingConfig config) {
        this.scoringCalculator = scoringCalculator;
        this.config = config;
    }

    public PricingConfig getConfig() {
        return config;
    }

    public PricingResult price(List<GolferHistory> histories, List<TeamRoster> rosters) {
        NormalizationBasis basis = config.getBasis();
        if (histories == null || histories.isEmpty()) {
            return PricingResult.empty(basis);
        }

        Map<String, GolferPerformanceProfile> profiles = new HashMap<>();
        for (GolferHistory history : histories) {
            profiles.put(history.getGolferId(), buildProfile(history));
        }

        Map<String, Double> normalized = basis == NormalizationBasis.RANK
            ? normalizeByCurrentPrice(histories)
            : normalizeByComposite(histories, profiles);

        List<PriceChange> changes = new ArrayList<>(histories.size());
        for (GolferHistory history : histories) {
            double score = normalized.get(history.getGolferId());
            long newPrice = priceFor(score);
            changes.add(PriceChange.builder()
                .golferId(history.getGolferId())
                .displayName(history.getDisplayName())
                .oldPrice(history.getCurrentPrice())
                .newPrice(newPrice)
                .normalizedScore(score)
                .tier(PriceTier.forPrice(newPrice))
                .profile(profiles.get(history.getGolferId()))
                .build());
        }

        assignRanks(changes);
        changes.sort(byNewPriceDescending());

        List<RankInversion> inversions = findRankInversions(changes);
        PricingReport report = PricingReport.builder()
            .rankInversions(inversions)
            .rankingPreserved(inversions.isEmpty())
            .overBudgetRosters(auditRosters(changes, rosters))
            .rostersAudited(rosters != null ? rosters.size() : 0)
            .pointDriftTotal(pointDrift(histories))
            .topRosterCost(topRosterCost(changes))
            .tierDistribution(tierDistribution(changes))
            .build();
        report.setCapForcesTradeOffs(report.getTopRosterCost() > config.getSalaryCap());

        return PricingResult.builder()
            .basis(basis)
            .prices(changes)
            .report(report)
            .build();
    }

    /**
     * Aggregates one golfer's history. Only results the golfer played in count.
     */
    public GolferPerformanceProfile buildProfile(GolferHistory history) {
        double totalPoints = 0;
        int timesPlayed = 0;
        int wins = 0;
        int podiums = 0;
        int bonusRounds = 0;

        for (ScoredResult scored : history.getResults()) {
            TournamentResult result = scored.getResult();
            if (result == null || !result.isParticipated()) {
                continue;
            }
            timesPlayed++;
            totalPoints += scored.getBreakdown() != null ? scored.getBreakdown().getMultipliedPoints() : 0;

            Integer position = result.getPosition();
            if (position != null && position == 1) {
                wins++;
            }
            if (position != null && position >= 1 && position <= 3) {
                podiums++;
            }
            if (scoringCalculator.isBonusRound(result.getRawPerformanceScore(), result.getScoringFormat())) {
                bonusRounds++;
            }
        }

        double rawAverage = timesPlayed > 0 ? totalPoints / timesPlayed : 0;
        double adjustedAverage = adjustedAverage(rawAverage, timesPlayed);
        double consistency = timesPlayed >= config.getConsistencyMinEvents()
            ? (double) bonusRounds / timesPlayed
            : 0;

        double composite = totalPoints * config.getTotalPointsWeight()
            + adjustedAverage * config.getAverageWeight()
            + wins * config.getWinsWeight()
            + podiums * config.getPodiumsWeight()
            + consistency * config.getConsistencyWeight();

        return GolferPerformanceProfile.builder()
            .golferId(history.getGolferId())
            .totalPoints(totalPoints)
            .timesPlayed(timesPlayed)
            .wins(wins)
            .podiums(podiums)
            .bonusRoundCount(bonusRounds)
            .rawAveragePointsPerEvent(rawAverage)
            .averagePointsPerEvent(adjustedAverage)
            .consistencyRate(consistency)
            .compositeScore(composite)
            .build();
    }

    /**
     * Blends a short record toward the league baseline in proportion to the missing events.
     */
    public double adjustedAverage(double rawAverage, int timesPlayed) {
        int minSample = config.getMinSampleSize();
        if (timesPlayed >= minSample) {
            return rawAverage;
        }
        return (rawAverage * timesPlayed + config.getBaselineAverage() * (minSample - timesPlayed)) / minSample;
    }

    /**
     * Maps a normalized score onto the price curve, rounded to the currency increment
     * and kept within [floor, ceiling].
     */
    public long priceFor(double normalizedScore) {
        double clamped = Math.max(0.0, Math.min(1.0, normalizedScore));
        double factor = Math.pow(clamped, config.getExponent());
        double rawPrice = config.getFloorPrice() + factor * config.priceRange();
        long rounded = Math.round(rawPrice / config.getRoundTo()) * config.getRoundTo();
        return Math.min(Math.max(rounded, config.getFloorPrice()), config.getCeilingPrice());
    }

    // A non-positive maximum uses a denominator of 1, which sends everyone to the floor
    private Map<String, Double> normalizeByComposite(List<GolferHistory> histories,
                                                     Map<String, GolferPerformanceProfile> profiles) {
        double maxComposite = profiles.values().stream()
            .mapToDouble(GolferPerformanceProfile::getCompositeScore)
            .max()
            .orElse(0);
        double denominator = maxComposite > 0 ? maxComposite : 1.0;

        Map<String, Double> normalized = new HashMap<>();
        for (GolferHistory history : histories) {
            double composite = profiles.get(history.getGolferId()).getCompositeScore();
            normalized.put(history.getGolferId(), Math.max(0.0, composite / denominator));
        }
        return normalized;
    }

    // Identical current prices (e.g. the first run) give a zero range, replaced by 1
    private Map<String, Double> normalizeByCurrentPrice(List<GolferHistory> histories) {
        long maxPrice = histories.stream().mapToLong(GolferHistory::getCurrentPrice).max().orElse(0);
        long minPrice = histories.stream().mapToLong(GolferHistory::getCurrentPrice).min().orElse(0);
        long range = maxPrice - minPrice;
        double denominator = range != 0 ? range : 1.0;

        Map<String, Double> normalized = new HashMap<>();
        for (GolferHistory history : histories) {
            normalized.put(history.getGolferId(), (history.getCurrentPrice() - minPrice) / denominator);
        }
        return normalized;
    }

    private void assignRanks(List<PriceChange> changes) {
        List<PriceChange> byOld = new ArrayList<>(changes);
        byOld.sort(Comparator.comparingLong(PriceChange::getOldPrice).reversed()
            .thenComparing(PriceChange::getGolferId));
        for (int i = 0; i < byOld.size(); i++) {
            PriceChange change = byOld.get(i);
            boolean tied = i > 0 && byOld.get(i - 1).getOldPrice() == change.getOldPrice();
            change.setOldRank(tied ? byOld.get(i - 1).getOldRank() : i + 1);
        }

        List<PriceChange> byNew = new ArrayList<>(changes);
        byNew.sort(byNewPriceDescending());
        for (int i = 0; i < byNew.size(); i++) {
            PriceChange change = byNew.get(i);
            boolean tied = i > 0 && byNew.get(i - 1).getNewPrice() == change.getNewPrice();
            change.setNewRank(tied ? byNew.get(i - 1).getNewRank() : i + 1);
        }
    }

    /**
     * Every pair that was strictly ordered before the run and is strictly reversed after it.
     * Ties on either side are not inversions.
     */
    private List<RankInversion> findRankInversions(List<PriceChange> changes) {
        List<PriceChange> byOld = new ArrayList<>(changes);
        byOld.sort(Comparator.comparingLong(PriceChange::getOldPrice).reversed()
            .thenComparing(PriceChange::getGolferId));

        List<RankInversion> inversions = new ArrayList<>();
        for (int i = 0; i < byOld.size(); i++) {
            PriceChange higher = byOld.get(i);
            for (int j = i + 1; j < byOld.size(); j++) {
                PriceChange lower = byOld.get(j);
                if (higher.getOldPrice() > lower.getOldPrice() && higher.getNewPrice() < lower.getNewPrice()) {
                    inversions.add(RankInversion.builder()
                        .formerlyHigherGolferId(higher.getGolferId())
                        .formerlyLowerGolferId(lower.getGolferId())
                        .formerlyHigherOldPrice(higher.getOldPrice())
                        .formerlyLowerOldPrice(lower.getOldPrice())
                        .formerlyHigherNewPrice(higher.getNewPrice())
                        .formerlyLowerNewPrice(lower.getNewPrice())
                        .build());
                }
            }
        }
        return inversions;
    }

    // Golfers missing from this run contribute nothing to a roster's cost
    private List<OverBudgetRoster> auditRosters(List<PriceChange> changes, List<TeamRoster> rosters) {
        List<OverBudgetRoster> overBudget = new ArrayList<>();
        if (rosters == null || rosters.isEmpty()) {
            return overBudget;
        }

        Map<String, Long> newPrices = new HashMap<>();
        changes.forEach(change -> newPrices.put(change.getGolferId(), change.getNewPrice()));

        for (TeamRoster roster : rosters) {
            long total = roster.getGolferIds().stream()
                .mapToLong(id -> newPrices.getOrDefault(id, 0L))
                .sum();
            if (total > config.getSalaryCap()) {
                overBudget.add(OverBudgetRoster.builder()
                    .rosterId(roster.getRosterId())
                    .userId(roster.getUserId())
                    .golferIds(List.copyOf(roster.getGolferIds()))
                    .totalCost(total)
                    .salaryCap(config.getSalaryCap())
                    .overBy(total - config.getSalaryCap())
                    .build());
            }
        }
        return overBudget;
    }

    // Stored history is rescored, not validated
    private double pointDrift(List<GolferHistory> histories) {
        double drift = 0;
        for (GolferHistory history : histories) {
            for (ScoredResult scored : history.getResults()) {
                if (scored.getResult() == null) {
                    continue;
                }
                double stored = scored.getBreakdown() != null ? scored.getBreakdown().getMultipliedPoints() : 0;
                double current = scoringCalculator.rescore(scored.getResult()).getMultipliedPoints();
                drift += current - stored;
            }
        }
        return drift;
    }

    // Expects changes already sorted by new price descending
    private long topRosterCost(List<PriceChange> changes) {
        return changes.stream()
            .limit(config.getRosterSize())
            .mapToLong(PriceChange::getNewPrice)
            .sum();
    }

    private Map<PriceTier, Integer> tierDistribution(List<PriceChange> changes) {
        Map<PriceTier, Integer> distribution = new EnumMap<>(PriceTier.class);
        for (PriceTier tier : PriceTier.values()) {
            distribution.put(tier, 0);
        }
        changes.forEach(change -> distribution.merge(change.getTier(), 1, Integer::sum));
        return distribution;
    }

    private static Comparator<PriceChange> byNewPriceDescending() {
        return Comparator.comparingLong(PriceChange::getNewPrice).reversed()
            .thenComparing(PriceChange::getGolferId);
    }
}
