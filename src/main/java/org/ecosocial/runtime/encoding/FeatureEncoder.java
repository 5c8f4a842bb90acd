package org.ecosocial.runtime.encoding;

import org.ecosocial.runtime.Config;
import org.ecosocial.runtime.StepWorkerPool;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.Signal;
import org.ecosocial.runtime.model.World;
import org.ecosocial.runtime.spatial.NeighborQuery;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Builds the fixed-length observation vector of every agent.
 * <p>
 * Layout (40 floats):
 * <pre>
 *  0- 1  position x, y
 *     2  health / 100
 *     3  food inventory
 *  4- 5  offset to the nearest resource cell (0, 0 if there is none)
 *  6- 8  personality one-hot: cooperative, aggressive, neutral
 *     9  1 if allied
 * 10-12  radius-3 neighbours: total, cooperative, aggressive
 * 13-15  radius-3 neighbour signals present: help, food, danger
 * 16-24  3x3 obstacle window, dx outer, dy inner, each from -1 to 1
 * 25-39  zero padding
 * </pre>
 * Encoding only reads the world. When a {@link StepWorkerPool} is supplied the agents are
 * encoded in parallel; the result is identical to the sequential pass.
 */
public class FeatureEncoder {

    public static final int OFFSET_POSITION = 0;
    public static final int OFFSET_HEALTH = 2;
    public static final int OFFSET_FOOD = 3;
    public static final int OFFSET_NEAREST_FOOD = 4;
    public static final int OFFSET_PERSONALITY = 6;
    public static final int OFFSET_ALLIANCE = 9;
    public static final int OFFSET_NEIGHBORS = 10;
    public static final int OFFSET_SIGNALS = 13;
    public static final int OFFSET_OBSTACLES = 16;
    public static final int OFFSET_PADDING = 25;

    private final StepWorkerPool pool;

    /**
     * Creates a sequential encoder.
     */
    public FeatureEncoder() {
        this(null);
    }

    /**
     * Creates an encoder that spreads agents over the given pool.
     * @param pool the worker pool, or {@code null} for sequential encoding
     */
    public FeatureEncoder(StepWorkerPool pool) {
        this.pool = pool;
    }

    /**
     * Encodes all agents in id order.
     *
     * @param world the world after all mutation for the step
     * @return one vector of length {@link Config#OBSERVATION_SIZE} per agent
     */
    public float[][] encodeAll(World world) {
        int count = world.getAgentCount();
        float[][] observations = new float[count][];
        if (pool == null || count < 2) {
            IntArrayList scratch = new IntArrayList();
            for (int i = 0; i < count; i++) {
                observations[i] = encode(world, world.getAgent(i), scratch);
            }
        } else {
            pool.dispatch(count, (from, to) -> {
                IntArrayList scratch = new IntArrayList();
                for (int i = from; i < to; i++) {
                    observations[i] = encode(world, world.getAgent(i), scratch);
                }
            });
        }
        return observations;
    }

    /**
     * Encodes a single agent.
     *
     * @param world the world
     * @param agent the agent to encode
     * @return the observation vector
     */
    public float[] encode(World world, Agent agent) {
        return encode(world, agent, new IntArrayList());
    }

    private float[] encode(World world, Agent agent, IntArrayList neighbors) {
        float[] v = new float[Config.OBSERVATION_SIZE];
        int x = agent.getX();
        int y = agent.getY();
        int i = 0;

        v[i++] = x;
        v[i++] = y;
        v[i++] = (float) (agent.getHealth() / Agent.MAX_HEALTH);
        v[i++] = agent.getFoodInventory();

        int nearest = nearestResource(world, x, y);
        if (nearest >= 0) {
            v[i++] = world.xOf(nearest) - x;
            v[i++] = world.yOf(nearest) - y;
        } else {
            v[i++] = 0f;
            v[i++] = 0f;
        }

        Personality personality = agent.getPersonality();
        v[i++] = personality == Personality.COOPERATIVE ? 1f : 0f;
        v[i++] = personality == Personality.AGGRESSIVE ? 1f : 0f;
        v[i++] = personality == Personality.NEUTRAL ? 1f : 0f;

        v[i++] = agent.isAllied() ? 1f : 0f;

        NeighborQuery.collect(world, agent, Config.OBSERVATION_RADIUS, neighbors);
        int cooperative = 0;
        int aggressive = 0;
        boolean help = false;
        boolean food = false;
        boolean danger = false;
        for (int k = 0; k < neighbors.size(); k++) {
            Agent other = world.getAgent(neighbors.getInt(k));
            switch (other.getPersonality()) {
                case COOPERATIVE -> cooperative++;
                case AGGRESSIVE -> aggressive++;
                default -> { }
            }
            Signal signal = other.getSignal();
            help |= signal == Signal.HELP;
            food |= signal == Signal.FOOD;
            danger |= signal == Signal.DANGER;
        }
        v[i++] = neighbors.size();
        v[i++] = cooperative;
        v[i++] = aggressive;
        v[i++] = help ? 1f : 0f;
        v[i++] = food ? 1f : 0f;
        v[i++] = danger ? 1f : 0f;

        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                v[i++] = world.isObstacle(x + dx, y + dy) ? 1f : 0f;
            }
        }

        // Reserved slots stay zero
        i += Config.OBSERVATION_PADDING;

        if (i != Config.OBSERVATION_SIZE) {
            throw new IllegalStateException("Observation for agent " + agent.getId() + " has " + i
                    + " elements, expected " + Config.OBSERVATION_SIZE);
        }
        return v;
    }

    /**
     * Finds the resource cell closest to (x, y); the first one in enumeration order wins ties.
     * @return the flat index, or -1 if there are no resource cells
     */
    private static int nearestResource(World world, int x, int y) {
        IntList cells = world.getResourceCells();
        int best = -1;
        long bestDistance = Long.MAX_VALUE;
        for (int k = 0; k < cells.size(); k++) {
            int cell = cells.getInt(k);
            long dx = world.xOf(cell) - x;
            long dy = world.yOf(cell) - y;
            long distance = dx * dx + dy * dy;
            if (distance < bestDistance) {
                bestDistance = distance;
                best = cell;
            }
        }
        return best;
    }
}
