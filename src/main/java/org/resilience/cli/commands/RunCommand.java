package org.resilience.cli.commands;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.resilience.cli.CommandLineInterface;
import org.resilience.cli.config.ConfigLoader;
import org.resilience.cli.config.RunSettings;
import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.Simulation;
import org.resilience.runtime.analytics.MetricsSnapshot;
import org.resilience.runtime.analytics.SimulationMetrics;
import org.resilience.runtime.internal.services.SeededRandomProvider;
import org.resilience.runtime.worldgen.LogOnDeath;
import org.resilience.runtime.worldgen.ModelInitializer;
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
 * CLI command that builds the model from configuration, runs it for a fixed number of ticks
 * and prints a summary of the final state.
 * <p>
 * Options given on the command line override {@code resilience.simulation} in the configuration.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Run the simulation for a fixed number of ticks and print a summary"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"-t", "--ticks"},
        description = "Number of ticks to run (default: resilience.simulation.ticks)"
    )
    private Long ticks;

    @Option(
        names = {"-s", "--seed"},
        description = "Random seed (default: resilience.simulation.seed)"
    )
    private Long seed;

    @Option(
        names = {"--report-interval"},
        description = "Ticks between progress log lines (default: resilience.simulation.report-interval)"
    )
    private Integer reportInterval;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            ModelParameters params = ConfigLoader.modelParameters(config);
            RunSettings run = ConfigLoader.runSettings(config).withOverrides(seed, ticks, reportInterval);
            long runTicks = run.ticks();
            long runSeed = run.seed();
            int interval = run.reportInterval();

            Simulation simulation = ModelInitializer.initialize(params, new SeededRandomProvider(runSeed));
            simulation.addDeathHandler(new LogOnDeath());

            log.info("Running {} ticks with seed {}", runTicks, runSeed);
            for (long t = 1; t <= runTicks; t++) {
                simulation.tick();
                if (t % interval == 0 || t == runTicks) {
                    MetricsSnapshot snapshot = SimulationMetrics.snapshot(simulation);
                    log.info("Tick {}: agents={} totalEnergy={} totalWaste={}",
                        snapshot.tick(), snapshot.liveAgents(), snapshot.totalEnergy(), snapshot.totalWaste());
                }
            }

            MetricsSnapshot last = SimulationMetrics.snapshot(simulation);
            log.info("Finished {} ticks: {} agents alive, {} died", last.tick(), last.liveAgents(),
                simulation.getTotalDeaths());
            printSummary(out, last, simulation.getTotalDeaths());
            return 0;

        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Run failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(PrintWriter out, MetricsSnapshot snapshot, long deaths) {
        out.printf(Locale.ROOT, "After %d steps:%n", snapshot.tick());
        out.printf(Locale.ROOT, "  Total waste in environment = %.4f%n", snapshot.totalWaste());
        out.printf(Locale.ROOT, "  Number of agents left      = %d%n", snapshot.liveAgents());
        out.printf(Locale.ROOT, "  Agents died                = %d%n", deaths);
        out.printf(Locale.ROOT, "  Total static energy        = %.4f%n", snapshot.staticEnergy());
        out.printf(Locale.ROOT, "  Total dynamic energy       = %.4f%n", snapshot.dynamicEnergy());
        out.printf(Locale.ROOT, "  Total energy               = %.4f%n", snapshot.totalEnergy());
        out.flush();
    }
}
