package org.spindlecheck.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spindlecheck.cli.CommandLineInterface;
import org.spindlecheck.cli.rendering.ConsoleReportRenderer;
import org.spindlecheck.runtime.Simulation;
import org.spindlecheck.runtime.SimulationOutcome;
import org.spindlecheck.runtime.SimulationResult;
import org.spindlecheck.runtime.SimulationSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Run one checkpoint simulation and print its trace and safety report"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_SAFETY_VIOLATION = 2;
    public static final int EXIT_APOPTOSIS = 3;

    @Option(
        names = {"-s", "--seed"},
        description = "Random seed, overrides spindlecheck.seed"
    )
    private Long seed;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

    @Option(
        names = {"-e", "--every"},
        description = "Print every N-th tick in summary format (default: 10)"
    )
    private int everyNTicks = 10;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        SimulationSettings settings;
        try {
            Config config = parent.getConfig();
            settings = SimulationSettings.fromConfig(config.getConfig("spindlecheck"));
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        if (seed != null) {
            settings = settings.withSeed(seed);
        }

        Simulation simulation = new Simulation(settings);
        SimulationResult result;
        if ("json".equalsIgnoreCase(format)) {
            result = simulation.run();
            Gson gson = new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
            out.println(gson.toJson(result));
            out.flush();
        } else {
            ConsoleReportRenderer renderer = new ConsoleReportRenderer(out, everyNTicks);
            out.println("--- SPINDLE CHECKPOINT SIMULATION START ---");
            out.println("Kinetochores: " + settings.totalKinetochores()
                    + ", activation threshold: " + settings.bus().activationThreshold()
                    + ", seed: " + settings.seed());
            if (!settings.variantAssignments().isEmpty()) {
                out.println("Variant pairs: " + settings.variantAssignments());
            }
            simulation.addTickListener(renderer);
            result = simulation.run();
            renderer.renderSummary(result);
        }
        return exitCodeFor(result);
    }

    static int exitCodeFor(SimulationResult result) {
        if (!result.safetyReport().passed()) {
            return EXIT_SAFETY_VIOLATION;
        }
        if (result.outcome() == SimulationOutcome.APOPTOSIS) {
            return EXIT_APOPTOSIS;
        }
        return EXIT_OK;
    }
}
