package com.fantasygolf.engine.repository.impl;

import com.fantasygolf.engine.model.RankedGolfer;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.resps.Tuple;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JedisPriceBoardRepositoryTest {

    @Test
    void testToRankedGolfers_EqualPricesShareRank() {
        List<Tuple> tuples = List.of(
            new Tuple("g1", 14_500_000.0),
            new Tuple("g2", 11_200_000.0),
            new Tuple("g3", 11_200_000.0),
            new Tuple("g4", 3_500_000.0));

        List<RankedGolfer> ranked = JedisPriceBoardRepository.toRankedGolfers(tuples);

        assertEquals(4, ranked.size());
        assertEquals(1, ranked.get(0).getRank());
        assertEquals(2, ranked.get(1).getRank());
        assertEquals(2, ranked.get(2).getRank());
        assertEquals(4, ranked.get(3).getRank());
        assertEquals(11_200_000L, ranked.get(2).getPrice());
        assertEquals("g3", ranked.get(2).getGolferId());
    }

    @Test
    void testToRankedGolfers_Empty() {
        assertTrue(JedisPriceBoardRepository.toRankedGolfers(List.of()).isEmpty());
    }

    @Test
    void testUnavailableBoardReturnsNothing() {
        // Never initialised, so there is no pool to read from
        JedisPriceBoardRepository repository = new JedisPriceBoardRepository();

        assertFalse(repository.isAvailable());
        assertTrue(repository.getTopN(10).isEmpty());
        assertThrows(IllegalStateException.class, () -> repository.replacePrices(Map.of("g1", 1L)));
    }
}
