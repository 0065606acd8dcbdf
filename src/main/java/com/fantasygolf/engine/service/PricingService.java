package com.fantasygolf.engine.service;

import com.fantasygolf.engine.exception.GolferNotFoundException;
import com.fantasygolf.engine.exception.PersistenceException;
import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.model.GolferHistory;
import com.fantasygolf.engine.model.GolferPerformanceProfile;
import com.fantasygolf.engine.model.OverBudgetRoster;
import com.fantasygolf.engine.model.PriceChange;
import com.fantasygolf.engine.model.PricingReport;
import com.fantasygolf.engine.model.PricingResult;
import com.fantasygolf.engine.model.PricingRun;
import com.fantasygolf.engine.model.RankInversion;
import com.fantasygolf.engine.model.RankedGolfer;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.model.ScoreRecord;
import com.fantasygolf.engine.model.ScoredResult;
import com.fantasygolf.engine.model.TeamRoster;
import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.repository.GolferRepository;
import com.fantasygolf.engine.repository.PriceBackupRepository;
import com.fantasygolf.engine.repository.PriceBoardRepository;
import com.fantasygolf.engine.repository.ScoreRepository;
import com.fantasygolf.engine.repository.TeamRosterRepository;
import com.fantasygolf.engine.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the pricing engine against a snapshot of storage: read everything, compute
 * everything, then (in apply mode) write every price.
 */
@Service
public class PricingService {

    private static final Logger logger = LoggerFactory.getLogger(PricingService.class);

    private final PricingEngine pricingEngine;
    private final GolferRepository golferRepository;
    private final TournamentRepository tournamentRepository;
    private final ScoreRepository scoreRepository;
    private final TeamRosterRepository teamRosterRepository;
    private final PriceBoardRepository priceBoardRepository;
    private final PriceBackupRepository priceBackupRepository;

    @Autowired
    public PricingService(
            PricingEngine pricingEngine,
            GolferRepository golferRepository,
            TournamentRepository tournamentRepository,
            ScoreRepository scoreRepository,
            TeamRosterRepository teamRosterRepository,
            PriceBoardRepository priceBoardRepository,
            PriceBackupRepository priceBackupRepository) {
        this.pricingEngine = pricingEngine;
        this.golferRepository = golferRepository;
        this.tournamentRepository = tournamentRepository;
        this.scoreRepository = scoreRepository;
        this.teamRosterRepository = teamRosterRepository;
        this.priceBoardRepository = priceBoardRepository;
        this.priceBackupRepository = priceBackupRepository;
    }

    /**
     * Preview and apply share the whole computation; only apply writes.
     */
    public PricingRun run(RunMode mode, boolean backup) {
        logger.info("Starting pricing run - mode: {}, basis: {}", mode, pricingEngine.getConfig().getBasis());

        Snapshot snapshot = loadSnapshot();
        PricingResult result = pricingEngine.price(snapshot.histories, snapshot.rosters);
        logReport(result);

        PricingRun.PricingRunBuilder run = PricingRun.builder()
            .mode(mode)
            .result(result)
            .skippedScores(snapshot.skippedScores);

        if (mode == RunMode.APPLY && !result.getPrices().isEmpty()) {
            if (backup) {
                run.backupFile(backupCurrentPrices(snapshot.golfers).toString());
            }
            run.pricesWritten(writePrices(result.getPrices(), snapshot.golfersById));
            run.priceBoardRefreshed(refreshPriceBoard(result.getPrices()));
        } else if (mode == RunMode.PREVIEW) {
            logger.info("Preview complete - no prices written");
        }

        return run.completedAt(Instant.now()).build();
    }

    /**
     * Current performance profile of one golfer, built exactly as a pricing run builds it.
     */
    public GolferPerformanceProfile getProfile(String golferId) {
        if (golferId == null || golferId.trim().isEmpty()) {
            throw new ValidationException("golferId", "must not be empty");
        }
        Golfer golfer = golferRepository.findById(golferId)
            .orElseThrow(() -> new GolferNotFoundException("Golfer not found with id: " + golferId));

        Map<String, Tournament> tournaments = loadTournaments();
        List<ScoredResult> results = new ArrayList<>();
        for (ScoreRecord record : scoreRepository.findByGolferId(golferId)) {
            Tournament tournament = tournaments.get(record.getTournamentId());
            if (tournament != null) {
                results.add(toScoredResult(record, tournament));
            }
        }
        return pricingEngine.buildProfile(toHistory(golfer, results));
    }

    /**
     * Most expensive golfers, from the price board when Redis is up, otherwise from storage.
     */
    public List<RankedGolfer> getTopPriced(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit", "must be greater than 0");
        }
        if (limit > 1000) {
            throw new ValidationException("limit", "cannot exceed 1000");
        }

        if (priceBoardRepository.isAvailable()) {
            List<RankedGolfer> fromBoard = priceBoardRepository.getTopN(limit);
            if (!fromBoard.isEmpty()) {
                return fromBoard;
            }
            logger.debug("Price board empty, falling back to storage");
        }

        List<Golfer> golfers = golferRepository.findTopByPrice(limit);
        List<RankedGolfer> ranked = new ArrayList<>();
        for (int i = 0; i < golfers.size(); i++) {
            long price = golfers.get(i).getPrice() != null ? golfers.get(i).getPrice() : 0L;
            int rank = i > 0 && ranked.get(i - 1).getPrice() == price ? ranked.get(i - 1).getRank() : i + 1;
            ranked.add(RankedGolfer.builder()
                .golferId(golfers.get(i).getGolferId())
                .rank(rank)
                .price(price)
                .build());
        }
        return ranked;
    }

    private Snapshot loadSnapshot() {
        try {
            Snapshot snapshot = new Snapshot();
            snapshot.golfers = golferRepository.findAll();
            snapshot.golfersById = snapshot.golfers.stream()
                .collect(Collectors.toMap(Golfer::getGolferId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
            snapshot.rosters = teamRosterRepository.findAll();

            Map<String, Tournament> tournaments = loadTournaments();
            Map<String, List<ScoredResult>> resultsByGolfer = new HashMap<>();
            for (ScoreRecord record : scoreRepository.findAll()) {
                Tournament tournament = tournaments.get(record.getTournamentId());
                if (tournament == null || !snapshot.golfersById.containsKey(record.getGolferId())) {
                    snapshot.skippedScores++;
                    continue;
                }
                resultsByGolfer.computeIfAbsent(record.getGolferId(), k -> new ArrayList<>())
                    .add(toScoredResult(record, tournament));
            }

            if (snapshot.skippedScores > 0) {
                logger.warn("Skipped {} scores referencing unknown tournaments or golfers", snapshot.skippedScores);
            }

            snapshot.histories = snapshot.golfers.stream()
                .map(golfer -> toHistory(golfer, resultsByGolfer.getOrDefault(golfer.getGolferId(), List.of())))
                .toList();
            logger.info("Loaded {} golfers, {} tournaments, {} rosters",
                snapshot.golfers.size(), tournaments.size(), snapshot.rosters.size());
            return snapshot;
        } catch (RuntimeException e) {
            logger.error("Failed to load pricing snapshot", e);
            throw new PersistenceException("Failed to load pricing snapshot: " + e.getMessage(), e);
        }
    }

    private Map<String, Tournament> loadTournaments() {
        return tournamentRepository.findAll().stream()
            .collect(Collectors.toMap(Tournament::getTournamentId, Function.identity(), (a, b) -> a));
    }

    private ScoredResult toScoredResult(ScoreRecord record, Tournament tournament) {
        return ScoredResult.builder()
            .result(ScoreRecomputationPlanner.toResult(record, tournament, record.getRawScore()))
            .breakdown(record.toBreakdown())
            .build();
    }

    private GolferHistory toHistory(Golfer golfer, List<ScoredResult> results) {
        return GolferHistory.builder()
            .golferId(golfer.getGolferId())
            .displayName(golfer.getDisplayName())
            .currentPrice(golfer.getPrice() != null ? golfer.getPrice() : 0L)
            .results(new ArrayList<>(results))
            .build();
    }

    private Path backupCurrentPrices(List<Golfer> golfers) {
        try {
            Path file = priceBackupRepository.backup(golfers);
            logger.info("Backed up {} current prices to {}", golfers.size(), file);
            return file;
        } catch (IOException e) {
            logger.error("Failed to back up current prices, aborting before any write", e);
            throw new PersistenceException("Failed to back up current prices: " + e.getMessage(), e);
        }
    }

    // Each golfer is saved on its own; a failure part way leaves every saved golfer consistent
    private int writePrices(List<PriceChange> prices, Map<String, Golfer> golfersById) {
        int written = 0;
        Instant now = Instant.now();
        for (PriceChange change : prices) {
            Golfer golfer = golfersById.get(change.getGolferId());
            golfer.setPrice(change.getNewPrice());
            golfer.setUpdatedAt(now);
            try {
                golferRepository.save(golfer);
                written++;
            } catch (Exception e) {
                logger.error("Failed to write price for golfer {} after {} of {} prices written",
                    change.getGolferId(), written, prices.size(), e);
                throw new PersistenceException("Failed to write price for golfer " + change.getGolferId(), e);
            }
        }
        logger.info("Updated {} golfer prices", written);
        return written;
    }

    private boolean refreshPriceBoard(List<PriceChange> prices) {
        if (!priceBoardRepository.isAvailable()) {
            logger.warn("Redis is not available, price board not refreshed");
            return false;
        }

        try {
            Map<String, Long> board = new HashMap<>();
            prices.forEach(change -> board.put(change.getGolferId(), change.getNewPrice()));
            priceBoardRepository.replacePrices(board);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to refresh price board, reads will fall back to storage", e);
            return false;
        }
    }

    private void logReport(PricingResult result) {
        PricingReport report = result.getReport();
        logger.info("Priced {} golfers - ranking preserved: {}, point drift: {}",
            result.getPrices().size(), report.isRankingPreserved(), report.getPointDriftTotal());

        for (RankInversion inversion : report.getRankInversions()) {
            logger.warn("Rank inversion: {} ({} -> {}) now below {} ({} -> {})",
                inversion.getFormerlyHigherGolferId(), inversion.getFormerlyHigherOldPrice(),
                inversion.getFormerlyHigherNewPrice(), inversion.getFormerlyLowerGolferId(),
                inversion.getFormerlyLowerOldPrice(), inversion.getFormerlyLowerNewPrice());
        }
        for (OverBudgetRoster roster : report.getOverBudgetRosters()) {
            logger.warn("Roster {} of user {} costs {} (over cap by {}), enforced at next transfer window",
                roster.getRosterId(), roster.getUserId(), roster.getTotalCost(), roster.getOverBy());
        }
        if (report.getRostersAudited() > 0 && report.getOverBudgetRosters().isEmpty()) {
            logger.info("No rosters exceed the salary cap ({} audited)", report.getRostersAudited());
        }

        logger.info("Tier distribution: {}", report.getTierDistribution());
        if (!result.getPrices().isEmpty() && !report.isCapForcesTradeOffs()) {
            logger.warn("Top roster costs {} and fits under the cap, consider tuning the curve", report.getTopRosterCost());
        }
    }

    private static class Snapshot {
        private List<Golfer> golfers = List.of();
        private Map<String, Golfer> golfersById = Map.of();
        private List<TeamRoster> rosters = List.of();
        private List<GolferHistory> histories = List.of();
        private int skippedScores;
    }
}
