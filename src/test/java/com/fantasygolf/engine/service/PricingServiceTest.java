package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.PricingConfig;
import com.fantasygolf.engine.config.ScoringRules;
import com.fantasygolf.engine.exception.GolferNotFoundException;
import com.fantasygolf.engine.exception.PersistenceException;
import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.Golfer;
import com.fantasygolf.engine.model.GolferPerformanceProfile;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.PricingRun;
import com.fantasygolf.engine.model.RankedGolfer;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.model.ScoreRecord;
import com.fantasygolf.engine.model.ScoringFormat;
import com.fantasygolf.engine.model.TeamRoster;
import com.fantasygolf.engine.model.Tournament;
import com.fantasygolf.engine.model.TournamentType;
import com.fantasygolf.engine.repository.GolferRepository;
import com.fantasygolf.engine.repository.PriceBackupRepository;
import com.fantasygolf.engine.repository.PriceBoardRepository;
import com.fantasygolf.engine.repository.ScoreRepository;
import com.fantasygolf.engine.repository.TeamRosterRepository;
import com.fantasygolf.engine.repository.TournamentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PricingServiceTest {

    @Mock
    private GolferRepository golferRepository;

    @Mock
    private TournamentRepository tournamentRepository;

    @Mock
    private ScoreRepository scoreRepository;

    @Mock
    private TeamRosterRepository teamRosterRepository;

    @Mock
    private PriceBoardRepository priceBoardRepository;

    @Mock
    private PriceBackupRepository priceBackupRepository;

    private PricingService pricingService;

    private Golfer champion;
    private Golfer journeyman;
    private Tournament tournament;
    private ScoreRecord winningScore;

    @BeforeEach
    void setUp() {
        PricingEngine engine = new PricingEngine(
            new ScoringCalculator(ScoringRules.defaults()), PricingConfig.defaults());
        pricingService = new PricingService(engine, golferRepository, tournamentRepository, scoreRepository,
            teamRosterRepository, priceBoardRepository, priceBackupRepository);

        champion = Golfer.builder().golferId("g1").firstName("Scottie").lastName("Scheffler").price(8_000_000L).build();
        journeyman = Golfer.builder().golferId("g2").firstName("Adam").lastName("Hadwin").price(10_000_000L).build();
        tournament = Tournament.builder()
            .tournamentId("t1")
            .tournamentType(TournamentType.REGULAR)
            .scoringFormat(ScoringFormat.STABLEFORD)
            .build();
        winningScore = ScoreRecord.builder()
            .scoreId("s1")
            .tournamentId("t1")
            .golferId("g1")
            .participated(true)
            .position(1)
            .rawScore(36.0)
            .build();
        winningScore.applyBreakdown(new PointBreakdown(10, 3, 13.0));
    }

    private void stubSnapshot(ScoreRecord... scores) {
        when(golferRepository.findAll()).thenReturn(List.of(champion, journeyman));
        when(teamRosterRepository.findAll()).thenReturn(List.of(TeamRoster.builder()
            .rosterId("r1")
            .userId("u1")
            .golferIds(List.of("g1", "g2"))
            .build()));
        when(tournamentRepository.findAll()).thenReturn(List.of(tournament));
        when(scoreRepository.findAll()).thenReturn(List.of(scores));
    }

    @Test
    void testRun_PreviewWritesNothing() {
        // Arrange
        stubSnapshot(winningScore);

        // Act
        PricingRun run = pricingService.run(RunMode.PREVIEW, true);

        // Assert
        assertEquals(RunMode.PREVIEW, run.getMode());
        assertEquals(2, run.getResult().getPrices().size());
        assertEquals("g1", run.getResult().getPrices().get(0).getGolferId());
        assertEquals(14_500_000L, run.getResult().getPrices().get(0).getNewPrice());
        assertFalse(run.getResult().getReport().isRankingPreserved());
        assertEquals(0, run.getPricesWritten());
        assertNull(run.getBackupFile());
        assertNotNull(run.getCompletedAt());

        verify(golferRepository, never()).save(any());
        verifyNoInteractions(priceBackupRepository, priceBoardRepository);
        assertEquals(8_000_000L, champion.getPrice());
    }

    @Test
    void testRun_ApplyBacksUpThenWritesAndRefreshesBoard() throws IOException {
        // Arrange
        stubSnapshot(winningScore);
        Path backupFile = Paths.get("data", "pricing-backup-1.json");
        when(priceBackupRepository.backup(anyList())).thenReturn(backupFile);
        when(golferRepository.save(any(Golfer.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(priceBoardRepository.isAvailable()).thenReturn(true);

        // Act
        PricingRun run = pricingService.run(RunMode.APPLY, true);

        // Assert
        assertEquals(2, run.getPricesWritten());
        assertEquals(backupFile.toString(), run.getBackupFile());
        assertTrue(run.isPriceBoardRefreshed());
        assertEquals(14_500_000L, champion.getPrice());
        assertNotNull(champion.getUpdatedAt());

        InOrder inOrder = inOrder(priceBackupRepository, golferRepository, priceBoardRepository);
        inOrder.verify(priceBackupRepository).backup(anyList());
        inOrder.verify(golferRepository, times(2)).save(any(Golfer.class));
        inOrder.verify(priceBoardRepository).replacePrices(anyMap());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Long>> boardCaptor = ArgumentCaptor.forClass(Map.class);
        verify(priceBoardRepository).replacePrices(boardCaptor.capture());
        assertEquals(14_500_000L, boardCaptor.getValue().get("g1"));
        assertEquals(journeyman.getPrice(), boardCaptor.getValue().get("g2"));
    }

    @Test
    void testRun_BackupFailureAbortsBeforeAnyWrite() throws IOException {
        // Arrange
        stubSnapshot(winningScore);
        when(priceBackupRepository.backup(anyList())).thenThrow(new IOException("disk full"));

        // Act & Assert
        PersistenceException ex = assertThrows(PersistenceException.class,
            () -> pricingService.run(RunMode.APPLY, true));
        assertEquals("PERSISTENCE_ERROR", ex.getErrorCode());
        verify(golferRepository, never()).save(any());
        verifyNoInteractions(priceBoardRepository);
    }

    @Test
    void testRun_ApplyWithoutRedisStillWritesPrices() {
        // Arrange
        stubSnapshot(winningScore);
        when(golferRepository.save(any(Golfer.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(priceBoardRepository.isAvailable()).thenReturn(false);

        // Act
        PricingRun run = pricingService.run(RunMode.APPLY, false);

        // Assert
        assertEquals(2, run.getPricesWritten());
        assertFalse(run.isPriceBoardRefreshed());
        verify(priceBoardRepository, never()).replacePrices(anyMap());
        verifyNoInteractions(priceBackupRepository);
    }

    @Test
    void testRun_ScoresForUnknownTournamentAreSkipped() {
        // Arrange
        ScoreRecord orphan = ScoreRecord.builder()
            .scoreId("s2")
            .tournamentId("cancelled")
            .golferId("g2")
            .participated(true)
            .position(1)
            .build();
        stubSnapshot(winningScore, orphan);

        // Act
        PricingRun run = pricingService.run(RunMode.PREVIEW, false);

        // Assert
        assertEquals(1, run.getSkippedScores());
        assertEquals(0, run.getResult().getPrices().stream()
            .filter(change -> change.getGolferId().equals("g2"))
            .findFirst()
            .orElseThrow()
            .getProfile()
            .getTimesPlayed());
    }

    @Test
    void testRun_SnapshotFailureIsPersistenceError() {
        // Arrange
        when(golferRepository.findAll()).thenThrow(new IllegalStateException("connection refused"));

        // Act & Assert
        assertThrows(PersistenceException.class, () -> pricingService.run(RunMode.APPLY, false));
        verify(golferRepository, never()).save(any());
    }

    @Test
    void testGetTopPriced_FromPriceBoard() {
        // Arrange
        List<RankedGolfer> board = List.of(
            RankedGolfer.builder().golferId("g1").rank(1).price(14_500_000L).build(),
            RankedGolfer.builder().golferId("g2").rank(2).price(5_900_000L).build());
        when(priceBoardRepository.isAvailable()).thenReturn(true);
        when(priceBoardRepository.getTopN(2)).thenReturn(board);

        // Act
        List<RankedGolfer> result = pricingService.getTopPriced(2);

        // Assert
        assertEquals(board, result);
        verify(golferRepository, never()).findTopByPrice(anyInt());
    }

    @Test
    void testGetTopPriced_FallsBackToStorage() {
        // Arrange
        Golfer tied = Golfer.builder().golferId("g3").firstName("Tom").lastName("Kim").price(10_000_000L).build();
        when(priceBoardRepository.isAvailable()).thenReturn(false);
        when(golferRepository.findTopByPrice(3)).thenReturn(List.of(journeyman, tied, champion));

        // Act
        List<RankedGolfer> result = pricingService.getTopPriced(3);

        // Assert
        assertEquals(3, result.size());
        assertEquals(1, result.get(0).getRank());
        assertEquals(1, result.get(1).getRank());
        assertEquals(3, result.get(2).getRank());
        assertEquals(8_000_000L, result.get(2).getPrice());
    }

    @Test
    void testGetTopPriced_InvalidLimit() {
        ValidationException ex = assertThrows(ValidationException.class, () -> pricingService.getTopPriced(0));
        assertEquals("limit", ex.getField());

        assertThrows(ValidationException.class, () -> pricingService.getTopPriced(1001));
        verifyNoInteractions(priceBoardRepository, golferRepository);
    }

    @Test
    void testGetProfile_Success() {
        // Arrange
        when(golferRepository.findById("g1")).thenReturn(Optional.of(champion));
        when(tournamentRepository.findAll()).thenReturn(List.of(tournament));
        when(scoreRepository.findByGolferId("g1")).thenReturn(List.of(winningScore));

        // Act
        GolferPerformanceProfile profile = pricingService.getProfile("g1");

        // Assert
        assertEquals("g1", profile.getGolferId());
        assertEquals(13.0, profile.getTotalPoints());
        assertEquals(1, profile.getWins());
        assertEquals(5.0, profile.getAveragePointsPerEvent(), 1e-9);
    }

    @Test
    void testGetProfile_NotFound() {
        // Arrange
        when(golferRepository.findById("missing")).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(GolferNotFoundException.class, () -> pricingService.getProfile("missing"));
    }
}
