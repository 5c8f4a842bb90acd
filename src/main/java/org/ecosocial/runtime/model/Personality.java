package org.ecosocial.runtime.model;

import org.ecosocial.runtime.spi.IRandomProvider;

/**
 * Immutable behavioural tag of an agent. Gates which social actions are effective.
 * <p>
 * The weights form the categorical table used when an episode is reset.
 */
public enum Personality {
    /** Shares food and forms alliances. */
    COOPERATIVE(0.4),
    /** Steals food. */
    AGGRESSIVE(0.3),
    /** Forages alone. */
    NEUTRAL(0.3);

    private final double weight;

    Personality(double weight) {
        this.weight = weight;
    }

    /**
     * Returns the probability of this personality being drawn at reset.
     * @return the weight in [0, 1]
     */
    public double getWeight() {
        return weight;
    }

    /**
     * Draws a personality from the fixed categorical table {0.4, 0.3, 0.3}.
     * Consumes exactly one double from the provider.
     *
     * @param random the episode's random source
     * @return the drawn personality
     */
    public static Personality draw(IRandomProvider random) {
        double u = random.nextDouble();
        double cumulative = 0.0;
        Personality[] values = values();
        for (Personality p : values) {
            cumulative += p.weight;
            if (u < cumulative) {
                return p;
            }
        }
        // Floating point rounding can leave u just above the cumulative sum
        return values[values.length - 1];
    }
}
