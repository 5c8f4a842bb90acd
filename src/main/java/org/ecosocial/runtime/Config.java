package org.ecosocial.runtime;

/**
 * Fixed rules of the ecosystem: radii, rewards and health adjustments.
 * Tunable dimensions (grid size, population, episode length) live in {@link SimulationSettings}.
 */
public final class Config {

    private Config() {}

    // Observation layout
    public static final int OBSERVATION_SIZE = 40;
    public static final int OBSERVATION_PADDING = 15;

    // Neighbourhoods (Euclidean, inclusive)
    public static final int OBSERVATION_RADIUS = 3;
    public static final int INTERACTION_RADIUS = 2;

    // Movement phase
    public static final double STEP_REWARD = -1.0;
    public static final double COLLISION_REWARD = -5.0;
    public static final double COLLISION_DAMAGE = 2.0;
    public static final double FOOD_REWARD = 15.0;
    public static final double FOOD_HEAL = 10.0;

    // Social phase
    public static final double SHARE_REWARD = 5.0;
    public static final double STEAL_REWARD = 10.0;
    public static final double STEAL_PENALTY = -10.0;
    public static final double ALLIANCE_REWARD = 3.0;
    public static final double HELP_REWARD = 2.0;

    // End of step
    public static final double ALLIANCE_HEALTH_BONUS = 0.1;
    public static final double HEALTH_DECAY = 0.2;

    public static final int DEFAULT_EPISODE_LENGTH = 500;
}
