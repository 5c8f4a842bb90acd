package org.ecosocial.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.ecosocial.cli.CommandLineInterface;
import org.ecosocial.runner.EpisodeRunner;
import org.ecosocial.runner.EpisodeRunnerFactory;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs episodes with the configured policy, telemetry sink and history store, then prints
 * one summary line per episode.
 */
@Command(
    name = "run",
    description = "Run simulation episodes"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"-e", "--episodes"},
        description = "Number of episodes (overrides runner.episodes)"
    )
    private Integer episodes;

    @Option(
        names = {"-s", "--seed"},
        description = "Base seed, episode i uses seed + i (overrides runner.seed)"
    )
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EpisodeRunner runner;
        try {
            Config config = parent.getConfig();
            runner = EpisodeRunnerFactory.create(config, episodes, seed);
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        List<EpisodeSummary> summaries;
        try {
            summaries = runner.run();
        } finally {
            runner.close();
        }

        out.println();
        out.println("=== Episodes ===");
        out.printf("%-8s %12s %9s %6s %6s %6s %9s %10s%n",
                "Episode", "Reward", "Survival", "Food", "Coop", "Theft", "Alliances", "AvgHealth");
        for (EpisodeSummary s : summaries) {
            out.printf("%-8d %12.1f %8.1f%% %6d %6d %6d %9d %10.1f%n",
                    s.episode(), s.totalReward(), s.survivalRate() * 100, (int) s.totalFoodCollected(),
                    s.cooperationEvents(), s.theftEvents(), s.numAlliances(), s.avgHealth());
        }
        out.flush();
        return 0;
    }
}
