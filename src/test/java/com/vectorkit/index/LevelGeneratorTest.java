package com.vectorkit.index;

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LevelGeneratorTest {

    @Test
    void shouldHalveLayerPopulationWithDefaultFactor() {
        LevelGenerator generator = new LevelGenerator(new Random(42), 16);
        int draws = 100_000;
        int[] reaching = new int[17];
        for (int i = 0; i < draws; i++) {
            int level = generator.nextLevel();
            for (int l = 0; l <= level; l++) {
                reaching[l]++;
            }
        }

        assertEquals(draws, reaching[0]);
        for (int l = 0; l < 4; l++) {
            double ratio = (double) reaching[l + 1] / reaching[l];
            assertTrue(ratio > 0.45 && ratio < 0.55, "layer " + l + " ratio was " + ratio);
        }
    }

    @Test
    void shouldClampToMaxLevel() {
        LevelGenerator generator = new LevelGenerator(new Random(7), 2, 50.0);
        for (int i = 0; i < 1_000; i++) {
            int level = generator.nextLevel();
            assertTrue(level >= 0 && level <= 2);
        }
    }

    @Test
    void shouldBeDeterministicForFixedSeed() {
        LevelGenerator first = new LevelGenerator(new Random(123), 16);
        LevelGenerator second = new LevelGenerator(new Random(123), 16);
        for (int i = 0; i < 100; i++) {
            assertEquals(first.nextLevel(), second.nextLevel());
        }
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(InvalidParameterException.class, () -> new LevelGenerator(new Random(), -1));
        assertThrows(InvalidParameterException.class, () -> new LevelGenerator(new Random(), 4, 0.0));
        assertThrows(InvalidParameterException.class, () -> new LevelGenerator(new Random(), 4, Double.NaN));
    }
}
