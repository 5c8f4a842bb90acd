package org.ecosocial.runner;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.ecosocial.runtime.ResetResult;
import org.ecosocial.runtime.Simulation;
import org.ecosocial.runtime.StepResult;
import org.ecosocial.runtime.metrics.StepMetrics;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.EpisodeMetadata;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.ecosocial.runtime.spi.IDecisionPolicy;
import org.ecosocial.runtime.spi.IEpisodeHistoryStore;
import org.ecosocial.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link Simulation} through a series of episodes with a decision policy.
 * <p>
 * Per episode: reset with the episode's seed, then alternate policy and step until the episode
 * is terminal. Telemetry snapshots are published every {@code telemetryInterval} steps and the
 * final summary is appended to the history store.
 * <p>
 * Telemetry and history are best effort. Their exceptions are logged at WARN and the run goes
 * on. Exceptions from the simulation or the policy propagate.
 */
public class EpisodeRunner {
    private static final Logger LOG = LoggerFactory.getLogger(EpisodeRunner.class);

    private final Simulation simulation;
    private final IDecisionPolicy policy;
    private final ITelemetrySink telemetry;
    private final IEpisodeHistoryStore history;
    private final RunnerSettings settings;
    private final Clock clock;

    public EpisodeRunner(Simulation simulation, IDecisionPolicy policy, ITelemetrySink telemetry,
                         IEpisodeHistoryStore history, RunnerSettings settings) {
        this(simulation, policy, telemetry, history, settings, Clock.systemDefaultZone());
    }

    public EpisodeRunner(Simulation simulation, IDecisionPolicy policy, ITelemetrySink telemetry,
                         IEpisodeHistoryStore history, RunnerSettings settings, Clock clock) {
        this.simulation = simulation;
        this.policy = policy;
        this.telemetry = telemetry;
        this.history = history;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs all configured episodes.
     *
     * @return the summary of each episode, in order
     */
    public List<EpisodeSummary> run() {
        LOG.info("Starting {} episode(s): agentType={} grid={} agents={} episodeLength={}",
                settings.episodes(), policy.getName(), simulation.getSettings().gridSize(),
                simulation.getSettings().numAgents(), simulation.getSettings().episodeLength());
        List<EpisodeSummary> summaries = new ArrayList<>(settings.episodes());
        for (int i = 0; i < settings.episodes(); i++) {
            summaries.add(runEpisode(i));
        }
        return Collections.unmodifiableList(summaries);
    }

    /**
     * Runs a single episode.
     *
     * @param episodeIndex 0-based index, determines the seed and the reported episode number
     * @return the episode summary
     */
    public EpisodeSummary runEpisode(int episodeIndex) {
        int episode = episodeIndex + 1;
        int maxSteps = simulation.getSettings().episodeLength();

        ResetResult reset = simulation.reset(settings.seedFor(episodeIndex));
        List<Personality> personalities = simulation.personalities();
        Map<Personality, Integer> counts = countPersonalities(personalities);
        LOG.info("Episode {}/{}: {} cooperative, {} aggressive, {} neutral", episode, settings.episodes(),
                counts.get(Personality.COOPERATIVE), counts.get(Personality.AGGRESSIVE), counts.get(Personality.NEUTRAL));
        notifyTelemetry("episodeStarted", 0, () -> telemetry.episodeStarted(episode, counts));

        float[][] observations = reset.observations();
        double totalReward = 0.0;
        StepMetrics metrics = null;
        boolean done = false;
        while (!done) {
            int[] actions = policy.selectActions(observations, personalities);
            StepResult result = simulation.step(actions);
            observations = result.observations();
            totalReward += result.totalReward();
            metrics = result.info();
            done = result.terminated() || result.truncated();

            int step = simulation.getCurrentStep();
            if (step % settings.telemetryInterval() == 0) {
                EpisodeMetadata metadata = EpisodeMetadata.of(episode, step, maxSteps, totalReward, policy.getName());
                notifyTelemetry("publish", step, () -> telemetry.publish(simulation.snapshot(), metadata));
            }
            if (step % settings.progressInterval() == 0) {
                LOG.info("Episode {} step {}/{}: survival={} alliances={} cooperation={} thefts={}",
                        episode, step, maxSteps, String.format("%.1f%%", metrics.survivalRate() * 100),
                        metrics.numAlliances(), metrics.cooperationEvents(), metrics.theftEvents());
            }
        }

        EpisodeSummary summary = EpisodeSummary.from(episode, totalReward, metrics, policy.getName(),
                Instant.now(clock).toString());
        LOG.info("Episode {} complete: reward={} survival={} food={} cooperation={} thefts={} alliances={} avgHealth={} scores={}",
                episode, String.format("%.1f", summary.totalReward()), String.format("%.2f", summary.survivalRate()),
                (int) summary.totalFoodCollected(), summary.cooperationEvents(), summary.theftEvents(),
                summary.numAlliances(), String.format("%.1f", summary.avgHealth()), summary.personalityScores());

        notifyTelemetry("episodeCompleted", maxSteps, () -> telemetry.episodeCompleted(summary));
        try {
            history.append(summary);
        } catch (Exception e) {
            LOG.warn("History store '{}' failed for episode {}: {}",
                    history.getClass().getSimpleName(), episode, e.getMessage());
        }
        return summary;
    }

    /**
     * Shuts down the simulation and closes the telemetry sink.
     */
    public void close() {
        simulation.shutdown();
        try {
            telemetry.close();
        } catch (Exception e) {
            LOG.warn("Telemetry sink '{}' failed to close: {}", telemetry.getClass().getSimpleName(), e.getMessage());
        }
    }

    private void notifyTelemetry(String event, int step, Runnable call) {
        try {
            call.run();
        } catch (Exception e) {
            LOG.warn("Telemetry sink '{}' failed on {} at step {}: {}",
                    telemetry.getClass().getSimpleName(), event, step, e.getMessage());
        }
    }

    private static Map<Personality, Integer> countPersonalities(List<Personality> personalities) {
        Map<Personality, Integer> counts = new EnumMap<>(Personality.class);
        for (Personality p : Personality.values()) {
            counts.put(p, 0);
        }
        for (Personality p : personalities) {
            counts.merge(p, 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
