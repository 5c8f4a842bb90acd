package org.ecosocial.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.ecosocial.agents.PersonalityBiasedPolicy;
import org.ecosocial.junit.extensions.logging.ExpectLog;
import org.ecosocial.junit.extensions.logging.LogLevel;
import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.ecosocial.runtime.Simulation;
import org.ecosocial.runtime.SimulationSettings;
import org.ecosocial.runtime.internal.services.SeededRandomProvider;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.EpisodeMetadata;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.ecosocial.runtime.spi.IEpisodeHistoryStore;
import org.ecosocial.runtime.spi.ITelemetrySink;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
class EpisodeRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final SimulationSettings SIMULATION = new SimulationSettings(6, 4, 3, 2, 20, 1);

    @Mock
    private ITelemetrySink telemetry;

    @Mock
    private IEpisodeHistoryStore history;

    private EpisodeRunner runner(Simulation simulation, RunnerSettings settings) {
        PersonalityBiasedPolicy policy = new PersonalityBiasedPolicy(new SeededRandomProvider(3L), ConfigFactory.empty());
        return new EpisodeRunner(simulation, policy, telemetry, history, settings, CLOCK);
    }

    @Test
    void runsEveryEpisodeAndRecordsItsSummary() throws IOException {
        EpisodeRunner runner = runner(new Simulation(SIMULATION), new RunnerSettings(2, 11L, 5, 10));

        List<EpisodeSummary> summaries = runner.run();

        assertThat(summaries).extracting(EpisodeSummary::episode).containsExactly(1, 2);
        assertThat(summaries).allSatisfy(summary -> {
            assertThat(summary.agentType()).isEqualTo("personality-biased");
            assertThat(summary.timestamp()).isEqualTo("2026-03-01T12:00:00Z");
            assertThat(summary.personalityScores()).containsOnlyKeys("cooperative", "aggressive", "neutral");
            assertThat(summary.survivalRate()).isBetween(0.0, 1.0);
        });

        ArgumentCaptor<EpisodeSummary> appended = ArgumentCaptor.forClass(EpisodeSummary.class);
        verify(history, times(2)).append(appended.capture());
        assertThat(appended.getAllValues()).isEqualTo(summaries);
        verify(telemetry, times(2)).episodeCompleted(any(EpisodeSummary.class));
    }

    @Test
    void publishesSnapshotsAtTheTelemetryInterval() {
        EpisodeRunner runner = runner(new Simulation(SIMULATION), new RunnerSettings(1, 11L, 5, 10));

        runner.run();

        ArgumentCaptor<EpisodeMetadata> metadata = ArgumentCaptor.forClass(EpisodeMetadata.class);
        verify(telemetry, times(4)).publish(any(), metadata.capture());
        assertThat(metadata.getAllValues()).extracting(EpisodeMetadata::step).containsExactly(5, 10, 15, 20);
        assertThat(metadata.getAllValues()).extracting(EpisodeMetadata::progress)
                .containsExactly(25.0, 50.0, 75.0, 100.0);
        assertThat(metadata.getAllValues()).allSatisfy(m -> {
            assertThat(m.episode()).isEqualTo(1);
            assertThat(m.maxSteps()).isEqualTo(20);
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void announcesEpisodeStartWithPersonalityCounts() {
        EpisodeRunner runner = runner(new Simulation(SIMULATION), new RunnerSettings(1, 11L, 5, 10));

        runner.run();

        ArgumentCaptor<Map<Personality, Integer>> counts = ArgumentCaptor.forClass(Map.class);
        verify(telemetry).episodeStarted(eq(1), counts.capture());
        assertThat(counts.getValue()).containsOnlyKeys(Personality.values());
        assertThat(counts.getValue().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(4);
    }

    @Test
    void derivesOneSeedPerEpisodeFromTheBaseSeed() {
        Simulation simulation = spy(new Simulation(SIMULATION));
        EpisodeRunner runner = runner(simulation, new RunnerSettings(3, 100L, 5, 10));

        runner.run();

        verify(simulation).reset(100L);
        verify(simulation).reset(101L);
        verify(simulation).reset(102L);
    }

    @Test
    void sameSeedReproducesTheSameSummaries() {
        RunnerSettings settings = new RunnerSettings(2, 42L, 5, 10);

        List<EpisodeSummary> first = runner(new Simulation(SIMULATION), settings).run();
        List<EpisodeSummary> second = runner(new Simulation(SIMULATION), settings).run();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Telemetry sink .* failed on publish .*boom", occurrences = 4)
    void failingTelemetryDoesNotStopTheEpisode() throws IOException {
        doThrow(new IllegalStateException("boom")).when(telemetry).publish(any(), any());
        EpisodeRunner runner = runner(new Simulation(SIMULATION), new RunnerSettings(1, 11L, 5, 10));

        assertThat(runner.run()).hasSize(1);
        verify(history).append(any(EpisodeSummary.class));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "History store .* failed for episode 1: disk full")
    void failingHistoryStoreIsLogged() throws IOException {
        doThrow(new IOException("disk full")).when(history).append(any(EpisodeSummary.class));
        EpisodeRunner runner = runner(new Simulation(SIMULATION), new RunnerSettings(1, 11L, 5, 10));

        assertThat(runner.run()).hasSize(1);
        verify(telemetry).episodeCompleted(any(EpisodeSummary.class));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Telemetry sink .* failed to close: closed twice")
    void closeReleasesSinkAndSimulation() {
        doThrow(new IllegalStateException("closed twice")).when(telemetry).close();
        Simulation simulation = spy(new Simulation(SIMULATION));

        runner(simulation, new RunnerSettings(1, 11L, 5, 10)).close();

        verify(simulation).shutdown();
        verify(telemetry).close();
    }

    @Test
    void settingsDeriveSeedsAndApplyOverrides() {
        RunnerSettings settings = RunnerSettings.fromConfig(ConfigFactory.parseString("episodes = 3"));

        assertThat(settings.baseSeed()).isNull();
        assertThat(settings.seedFor(2)).isNull();
        assertThat(settings.telemetryInterval()).isEqualTo(10);
        assertThat(settings.progressInterval()).isEqualTo(100);

        RunnerSettings overridden = settings.withOverrides(5, 9L);
        assertThat(overridden.episodes()).isEqualTo(5);
        assertThat(overridden.seedFor(2)).isEqualTo(11L);
    }
}
