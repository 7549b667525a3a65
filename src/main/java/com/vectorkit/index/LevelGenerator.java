package com.vectorkit.index;

import java.util.Random;

/**
 * Draws the top layer of a new node: {@code floor(-ln(u) * levelFactor)} for {@code u} in (0, 1],
 * clamped to {@code maxLevel}. With the default factor of {@code 1 / ln 2} each layer holds about
 * half the nodes of the one below.
 */
public class LevelGenerator {
    public static final double DEFAULT_LEVEL_FACTOR = 1.0 / Math.log(2.0);

    private final Random random;
    private final int maxLevel;
    private final double levelFactor;

    public LevelGenerator(Random random, int maxLevel) {
        this(random, maxLevel, DEFAULT_LEVEL_FACTOR);
    }

    public LevelGenerator(Random random, int maxLevel, double levelFactor) {
        if (maxLevel < 0) {
            throw new InvalidParameterException("maxLevel must be >= 0, got " + maxLevel);
        }
        if (!(levelFactor > 0.0) || Double.isInfinite(levelFactor)) {
            throw new InvalidParameterException("levelFactor must be a positive finite number, got " + levelFactor);
        }
        this.random = random;
        this.maxLevel = maxLevel;
        this.levelFactor = levelFactor;
    }

    public int nextLevel() {
        double u = 1.0 - random.nextDouble();
        int level = (int) Math.floor(-Math.log(u) * levelFactor);
        return Math.min(level, maxLevel);
    }
}
