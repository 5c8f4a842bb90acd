package org.ecosocial.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.ecosocial.runtime.encoding.FeatureEncoder;
import org.ecosocial.runtime.internal.services.SeededRandomProvider;
import org.ecosocial.runtime.metrics.MetricsAggregator;
import org.ecosocial.runtime.metrics.StepMetrics;
import org.ecosocial.runtime.model.Action;
import org.ecosocial.runtime.model.Agent;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.model.Signal;
import org.ecosocial.runtime.model.World;
import org.ecosocial.runtime.phases.MovementResolver;
import org.ecosocial.runtime.phases.SocialResolver;
import org.ecosocial.runtime.spi.IRandomProvider;
import org.ecosocial.runtime.worldgen.WorldGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * The multi-agent grid world. Owns the current episode and advances it one step at a time.
 * <p>
 * A step runs in a fixed order:
 * <ol>
 *   <li>validate the action vector (nothing is mutated if it is invalid),</li>
 *   <li>movement and foraging for every agent in id order,</li>
 *   <li>social interactions for every agent in id order, the alliance bonus and health decay,</li>
 *   <li>step counter, alliance consistency check, encoding and metrics.</li>
 * </ol>
 * Only the final encoding pass may run on several threads; all mutation happens on the caller's
 * thread. For a fixed seed and action sequence the results are identical in every
 * parallelism mode.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. One thread drives a simulation.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationSettings settings;
    private final WorldGenerator generator;
    private final SocialResolver socialResolver = new SocialResolver();
    private final FeatureEncoder encoder;
    private final StepWorkerPool workerPool;
    private final int effectiveParallelism;

    private World world;
    private MovementResolver movementResolver;
    private long seed;
    private boolean terminated;

    /**
     * Creates a simulation. No episode exists until {@link #reset(Long)} is called.
     *
     * @param settings world dimensions and episode length.
     *                 {@code parallelism} 0 = auto ({@code max(1, availableProcessors - 2)}),
     *                 1 = sequential, N &gt; 1 = exactly N threads via {@link StepWorkerPool}.
     */
    public Simulation(SimulationSettings settings) {
        this.settings = settings;
        this.generator = new WorldGenerator(settings);
        this.effectiveParallelism = resolveParallelism(settings.parallelism());
        this.workerPool = (effectiveParallelism > 1) ? new StepWorkerPool(effectiveParallelism) : null;
        this.encoder = new FeatureEncoder(workerPool);
    }

    /**
     * Creates a simulation positioned at the start of a hand-built episode, for scenario tests
     * and replays. The world's grid size and agent count must match the settings.
     *
     * @param settings the settings, used for episode length and parallelism
     * @param world a freshly built world
     * @param random the random source used for resource respawn
     * @return a simulation ready for {@link #step(int[])}
     */
    public static Simulation forScenario(SimulationSettings settings, World world, IRandomProvider random) {
        if (world.getGridSize() != settings.gridSize() || world.getAgentCount() != settings.numAgents()) {
            throw new IllegalArgumentException("World (grid " + world.getGridSize() + ", " + world.getAgentCount()
                    + " agents) does not match settings " + settings);
        }
        Simulation simulation = new Simulation(settings);
        simulation.begin(world, random);
        return simulation;
    }

    /**
     * Starts a new episode, replacing any previous one.
     *
     * @param seed the episode seed, or {@code null} to draw a fresh one
     * @return the initial observations and an empty info map
     */
    public ResetResult reset(Long seed) {
        long effectiveSeed = (seed != null) ? seed : ThreadLocalRandom.current().nextLong();
        SeededRandomProvider provider = new SeededRandomProvider(effectiveSeed);
        this.seed = effectiveSeed;
        begin(generator.generate(provider), provider);

        if (LOG.isInfoEnabled()) {
            LOG.info("Episode reset: seed={}{} grid={} agents={} food={} obstacles={} personalities={}",
                    effectiveSeed, seed == null ? " (drawn)" : "", settings.gridSize(), world.getAgentCount(),
                    world.getResourceCount(), world.getObstacleCount(), personalityMix());
        }
        return new ResetResult(encoder.encodeAll(world), Collections.emptyMap());
    }

    /**
     * Advances the episode by one step.
     *
     * @param actions one action code per agent, in id order, each in [0, 8]
     * @return observations, rewards, the termination flag and metrics
     * @throws IllegalStateException if no episode has been reset or the episode is terminated
     * @throws IllegalArgumentException if the action vector has the wrong length or an unknown code
     */
    public StepResult step(int[] actions) {
        if (world == null) {
            throw new IllegalStateException("reset() must be called before step()");
        }
        if (terminated) {
            throw new IllegalStateException("Episode ended at step " + world.getStep() + "; call reset() first");
        }
        Action[] decoded = decode(actions);
        double[] rewards = new double[world.getAgentCount()];

        movementResolver.resolve(world, decoded, rewards);
        socialResolver.resolve(world, decoded, rewards);

        world.advanceStep();
        world.getAlliances().verifyConsistency();

        float[][] observations = encoder.encodeAll(world);
        StepMetrics metrics = MetricsAggregator.aggregate(world);
        terminated = world.getStep() >= settings.episodeLength();

        if (LOG.isDebugEnabled()) {
            LOG.debug("Step={} survival={} avgScore={} alliances={} cooperation={} thefts={}",
                    world.getStep(), metrics.survivalRate(), metrics.avgScore(), metrics.numAlliances(),
                    metrics.cooperationEvents(), metrics.theftEvents());
        }
        if (terminated) {
            LOG.info("Episode finished after {} steps: survival={} avgScore={} alliances={}",
                    world.getStep(), metrics.survivalRate(), metrics.avgScore(), metrics.numAlliances());
        }
        return new StepResult(observations, rewards, terminated, false, metrics);
    }

    /**
     * Returns a detached copy of the current world for display and telemetry.
     *
     * @return the snapshot
     * @throws IllegalStateException if no episode has been reset
     */
    public WorldSnapshot snapshot() {
        requireEpisode();
        List<Agent> agents = world.getAgents();
        int n = agents.size();
        int[][] positions = new int[n][];
        int[] scores = new int[n];
        double[] health = new double[n];
        Personality[] personalities = new Personality[n];
        int[] alliances = new int[n];
        int[] inventory = new int[n];
        Signal[] signals = new Signal[n];
        for (int i = 0; i < n; i++) {
            Agent agent = agents.get(i);
            positions[i] = new int[] {agent.getX(), agent.getY()};
            scores[i] = agent.getScore();
            health[i] = agent.getHealth();
            personalities[i] = agent.getPersonality();
            alliances[i] = agent.getAllianceId();
            inventory[i] = agent.getFoodInventory();
            signals[i] = agent.getSignal();
        }

        IntList resourceCells = world.getResourceCells();
        int[][] food = new int[resourceCells.size()][];
        for (int i = 0; i < food.length; i++) {
            int cell = resourceCells.getInt(i);
            food[i] = new int[] {world.xOf(cell), world.yOf(cell)};
        }
        int[] obstacleCells = world.getObstacleCells();
        int[][] obstacles = new int[obstacleCells.length][];
        for (int i = 0; i < obstacles.length; i++) {
            obstacles[i] = new int[] {world.xOf(obstacleCells[i]), world.yOf(obstacleCells[i])};
        }

        StepMetrics metrics = MetricsAggregator.aggregate(world);
        return new WorldSnapshot(settings.gridSize(), positions, food, obstacles, scores, health, personalities,
                alliances, inventory, signals, world.getStep(), metrics.survivalRate(), world.getCooperationEvents(),
                world.getTheftEvents(), metrics.numAlliances(), metrics.avgHealth());
    }

    /**
     * Returns the personality of every agent in id order.
     *
     * @return an unmodifiable list of personalities
     * @throws IllegalStateException if no episode has been reset
     */
    public List<Personality> personalities() {
        requireEpisode();
        List<Personality> result = new ArrayList<>(world.getAgentCount());
        for (Agent agent : world.getAgents()) {
            result.add(agent.getPersonality());
        }
        return Collections.unmodifiableList(result);
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    /**
     * Returns the seed of the current episode. Meaningless for scenario simulations.
     * @return the seed passed to or drawn by the last {@link #reset(Long)}
     */
    public long getSeed() {
        return seed;
    }

    public int getCurrentStep() {
        return world == null ? 0 : world.getStep();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Returns the effective parallelism of the encoding pass.
     *
     * @return the number of threads (1 = sequential, &gt; 1 = parallel)
     */
    public int getEffectiveParallelism() {
        return effectiveParallelism;
    }

    /**
     * Shuts down the encoding worker pool. Safe to call multiple times or when no pool was
     * created. Must not be called concurrently with {@link #step(int[])}.
     */
    public void shutdown() {
        if (workerPool != null) {
            workerPool.shutdown();
        }
    }

    private void begin(World newWorld, IRandomProvider newRandom) {
        this.world = newWorld;
        this.movementResolver = new MovementResolver(newRandom);
        this.terminated = false;
    }

    private Action[] decode(int[] actions) {
        if (actions == null) {
            throw new IllegalArgumentException("Action vector must not be null");
        }
        if (actions.length != world.getAgentCount()) {
            throw new IllegalArgumentException("Expected " + world.getAgentCount() + " actions, got " + actions.length);
        }
        Action[] decoded = new Action[actions.length];
        for (int i = 0; i < actions.length; i++) {
            int code = actions[i];
            if (code < Action.MIN_CODE || code > Action.MAX_CODE) {
                throw new IllegalArgumentException("Action " + code + " for agent " + i + " is outside ["
                        + Action.MIN_CODE + ", " + Action.MAX_CODE + "]");
            }
            decoded[i] = Action.fromCode(code);
        }
        return decoded;
    }

    private Map<Personality, Integer> personalityMix() {
        Map<Personality, Integer> mix = new EnumMap<>(Personality.class);
        for (Personality p : Personality.values()) {
            mix.put(p, 0);
        }
        for (Agent agent : world.getAgents()) {
            mix.merge(agent.getPersonality(), 1, Integer::sum);
        }
        return mix;
    }

    private void requireEpisode() {
        if (world == null) {
            throw new IllegalStateException("No episode; call reset() first");
        }
    }

    private static int resolveParallelism(int configured) {
        if (configured == 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
        }
        return configured;
    }
}
