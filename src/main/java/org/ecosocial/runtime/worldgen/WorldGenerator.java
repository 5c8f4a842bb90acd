package org.ecosocial.runtime.worldgen;

import org.ecosocial.runtime.SimulationSettings;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.World;
import org.ecosocial.runtime.spi.IRandomProvider;

/**
 * Populates a fresh world at the start of an episode.
 * <p>
 * Draw order is fixed so that a seed fully determines the world:
 * <ol>
 *   <li>for each agent in id order: personality, then x, then y,</li>
 *   <li>{@code numFood} resource cells, x then y, with replacement (duplicates are kept),</li>
 *   <li>{@code numObstacles} obstacle cells, x then y, collapsed into a set.</li>
 * </ol>
 * Agents, resources and obstacles are placed independently and may share cells.
 */
public class WorldGenerator {

    private final SimulationSettings settings;

    /**
     * @param settings the world dimensions
     */
    public WorldGenerator(SimulationSettings settings) {
        this.settings = settings;
    }

    /**
     * Generates a world.
     *
     * @param random the episode's random source
     * @return the populated world
     */
    public World generate(IRandomProvider random) {
        int size = settings.gridSize();
        World.Builder builder = World.builder(size);

        for (int id = 0; id < settings.numAgents(); id++) {
            Personality personality = Personality.draw(random);
            int x = random.nextInt(size);
            int y = random.nextInt(size);
            builder.agent(Agent.create(id, personality, x, y));
        }
        for (int i = 0; i < settings.numFood(); i++) {
            int x = random.nextInt(size);
            int y = random.nextInt(size);
            builder.resource(x, y);
        }
        for (int i = 0; i < settings.numObstacles(); i++) {
            int x = random.nextInt(size);
            int y = random.nextInt(size);
            builder.obstacle(x, y);
        }
        return builder.build();
    }
}
