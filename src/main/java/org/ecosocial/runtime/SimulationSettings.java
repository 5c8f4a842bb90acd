package org.ecosocial.runtime;

import com.typesafe.config.Config;

/**
 * Dimensions of a simulation. Validated on construction, so an invalid world is never built.
 *
 * @param gridSize side length of the square grid, &gt; 0
 * @param numAgents number of agents, &gt; 0
 * @param numFood number of resource units, &gt;= 0
 * @param numObstacles number of obstacle placements before duplicates collapse, &gt;= 0
 * @param episodeLength number of steps after which the episode is terminal, &gt; 0
 * @param parallelism threads for the encoding pass: 0 = auto, 1 = sequential, N = exactly N
 */
public record SimulationSettings(
    int gridSize,
    int numAgents,
    int numFood,
    int numObstacles,
    int episodeLength,
    int parallelism
) {
    public SimulationSettings {
        if (gridSize <= 0) {
            throw new IllegalArgumentException("grid-size must be > 0, got " + gridSize);
        }
        if (numAgents <= 0) {
            throw new IllegalArgumentException("num-agents must be > 0, got " + numAgents);
        }
        if (numFood < 0) {
            throw new IllegalArgumentException("num-food must be >= 0, got " + numFood);
        }
        if (numObstacles < 0) {
            throw new IllegalArgumentException("num-obstacles must be >= 0, got " + numObstacles);
        }
        if (episodeLength <= 0) {
            throw new IllegalArgumentException("episode-length must be > 0, got " + episodeLength);
        }
        if (parallelism < 0) {
            throw new IllegalArgumentException("parallelism must be >= 0, got " + parallelism);
        }
    }

    /**
     * Settings with the default episode length and sequential encoding.
     */
    public SimulationSettings(int gridSize, int numAgents, int numFood, int numObstacles) {
        this(gridSize, numAgents, numFood, numObstacles, org.ecosocial.runtime.Config.DEFAULT_EPISODE_LENGTH, 1);
    }

    /**
     * Reads settings from the {@code simulation} block of the application configuration.
     * {@code episode-length} and {@code parallelism} are optional.
     *
     * @param config the {@code simulation} configuration block
     * @return the validated settings
     * @throws com.typesafe.config.ConfigException if a required key is missing or mistyped
     */
    public static SimulationSettings fromConfig(Config config) {
        return new SimulationSettings(
                config.getInt("grid-size"),
                config.getInt("num-agents"),
                config.getInt("num-food"),
                config.getInt("num-obstacles"),
                config.hasPath("episode-length")
                        ? config.getInt("episode-length")
                        : org.ecosocial.runtime.Config.DEFAULT_EPISODE_LENGTH,
                config.hasPath("parallelism") ? config.getInt("parallelism") : 1);
    }
}
