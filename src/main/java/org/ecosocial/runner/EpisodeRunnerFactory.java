package org.ecosocial.runner;

import java.util.concurrent.ThreadLocalRandom;

import org.ecosocial.datapipeline.history.JsonEpisodeHistoryStore;
import org.ecosocial.datapipeline.telemetry.NoOpTelemetrySink;
import org.ecosocial.runtime.Simulation;
import org.ecosocial.runtime.SimulationSettings;
import org.ecosocial.runtime.internal.services.SeededRandomProvider;
import org.ecosocial.runtime.spi.IDecisionPolicy;
import org.ecosocial.runtime.spi.IEpisodeHistoryStore;
import org.ecosocial.runtime.spi.IRandomProvider;
import org.ecosocial.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Assembles an {@link EpisodeRunner} from the application configuration.
 * <p>
 * Collaborators are named by a {@code className} and an optional {@code options} block and are
 * instantiated reflectively:
 * <pre>
 * policy    { className = "...", options { } }   (IRandomProvider, Config) constructor
 * telemetry { enabled = true, className = "...", options { } }   (Config) constructor
 * history   { className = "...", options { } }   (Config) constructor
 * </pre>
 * The policy receives its own random sub-stream so that its draws never shift the world's
 * placement and respawn stream.
 */
public final class EpisodeRunnerFactory {
    private static final Logger LOG = LoggerFactory.getLogger(EpisodeRunnerFactory.class);

    private EpisodeRunnerFactory() {
    }

    /**
     * Creates a runner.
     *
     * @param config the resolved application configuration
     * @param episodesOverride episode count replacing {@code runner.episodes}, or {@code null}
     * @param seedOverride base seed replacing {@code runner.seed}, or {@code null}
     * @return the runner, owning a fresh simulation
     * @throws IllegalArgumentException if a collaborator cannot be instantiated
     * @throws com.typesafe.config.ConfigException if a required key is missing
     */
    public static EpisodeRunner create(Config config, Integer episodesOverride, Long seedOverride) {
        SimulationSettings simulationSettings = SimulationSettings.fromConfig(config.getConfig("simulation"));
        RunnerSettings runnerSettings = RunnerSettings.fromConfig(config.getConfig("runner"))
                .withOverrides(episodesOverride, seedOverride);

        long policySeed = runnerSettings.baseSeed() != null
                ? runnerSettings.baseSeed()
                : ThreadLocalRandom.current().nextLong();
        IRandomProvider policyRandom = new SeededRandomProvider(policySeed).deriveFor("policy", 0);

        IDecisionPolicy policy = createPolicy(config.getConfig("policy"), policyRandom);
        ITelemetrySink telemetry = createTelemetrySink(config.getConfig("telemetry"));
        IEpisodeHistoryStore history = createHistoryStore(config.getConfig("history"));

        LOG.debug("Assembled runner: policy={} telemetry={} history={}", policy.getClass().getSimpleName(),
                telemetry.getClass().getSimpleName(), history.getClass().getSimpleName());
        return new EpisodeRunner(new Simulation(simulationSettings), policy, telemetry, history, runnerSettings);
    }

    static IDecisionPolicy createPolicy(Config block, IRandomProvider random) {
        String className = block.getString("className");
        try {
            return Class.forName(className)
                    .asSubclass(IDecisionPolicy.class)
                    .getConstructor(IRandomProvider.class, Config.class)
                    .newInstance(random, options(block));
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalArgumentException("Failed to instantiate decision policy: " + className, e);
        }
    }

    static ITelemetrySink createTelemetrySink(Config block) {
        if (block.hasPath("enabled") && !block.getBoolean("enabled")) {
            return new NoOpTelemetrySink();
        }
        return instantiate(block, ITelemetrySink.class, "telemetry sink");
    }

    static IEpisodeHistoryStore createHistoryStore(Config block) {
        if (!block.hasPath("className")) {
            return new JsonEpisodeHistoryStore(options(block));
        }
        return instantiate(block, IEpisodeHistoryStore.class, "history store");
    }

    private static <T> T instantiate(Config block, Class<T> type, String role) {
        String className = block.getString("className");
        try {
            return Class.forName(className)
                    .asSubclass(type)
                    .getConstructor(Config.class)
                    .newInstance(options(block));
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalArgumentException("Failed to instantiate " + role + ": " + className, e);
        }
    }

    private static Config options(Config block) {
        return block.hasPath("options") ? block.getConfig("options") : ConfigFactory.empty();
    }
}
