package org.rgen.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.rgen.cli.CommandLineInterface;
import org.rgen.cli.WorldReport;
import org.rgen.generation.EntityFactory;
import org.rgen.generation.GenerationRequest;
import org.rgen.generation.TemplateContentGenerator;
import org.rgen.runtime.CancellationToken;
import org.rgen.runtime.RunResult;
import org.rgen.runtime.SimulationParameters;
import org.rgen.runtime.Simulator;
import org.rgen.runtime.World;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.AutosaveService;
import org.rgen.runtime.persistence.PersistenceSettings;
import org.rgen.runtime.persistence.StateManager;
import org.rgen.runtime.persistence.VersionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "simulate",
    description = "Create (or load) a world, run it for a number of steps and optionally save it"
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SimulateCommand.class);

    @Option(names = {"-s", "--seed"}, description = "World seed (default: rgen.simulation.seed)")
    private Long seed;

    @Option(names = {"-n", "--name"}, description = "World name (default: rgen.simulation.world-name)")
    private String worldName;

    @Option(names = "--locations", description = "Number of generated locations")
    private Integer locationCount;

    @Option(names = "--npcs", description = "Number of generated NPCs")
    private Integer npcCount;

    @Option(names = "--steps", description = "Number of steps to run")
    private Integer steps;

    @Option(names = {"-m", "--step-minutes"}, description = "Simulated minutes per step")
    private Long stepMinutes;

    @Option(names = {"-l", "--load"}, description = "Continue a saved world instead of generating a new one")
    private String loadName;

    @Option(names = "--save", description = "Save the world under this name after the run")
    private String saveName;

    @Option(names = {"-f", "--format"}, description = "Snapshot format: json or binary")
    private String format;

    @Option(names = "--compress", description = "Compress saves with zstd")
    private Boolean compress;

    @Option(names = "--save-dir", description = "Directory for saves (default: rgen.persistence.save-directory)")
    private Path saveDirectory;

    @Option(names = "--autosave", description = "Enable periodic autosave into rotating slots")
    private Boolean autosave;

    @Option(names = "--events", description = "Number of recent events to print (default: ${DEFAULT-VALUE})")
    private int eventCount = 10;

    @Option(names = "--entities", description = "Print every active entity after the run")
    private boolean printEntities;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Config config = ConfigFactory.parseMap(overrides()).withFallback(parent.getConfig()).resolve();
            Config simulation = config.getConfig("rgen.simulation");
            SimulationParameters parameters = SimulationParameters.fromConfig(config);
            PersistenceSettings persistence = PersistenceSettings.fromConfig(config.getConfig("rgen.persistence"));
            StateManager stateManager = new StateManager(persistence);
            TemplateContentGenerator generator = new TemplateContentGenerator();
            EntityFactory factory = new EntityFactory(parameters.behavior());

            World world = loadName != null
                ? stateManager.load(loadName, parameters, generator, factory)
                : World.createNew(new GenerationRequest(simulation.getLong("seed"), simulation.getInt("location-count"),
                    simulation.getInt("npc-count"), simulation.getString("world-name")), generator, factory, parameters);

            Simulator simulator = new Simulator(world);
            RunResult result;
            try (AutosaveService autosaveService = new AutosaveService(stateManager, persistence.autosave())) {
                simulator.addObserver(autosaveService);
                result = runInterruptibly(simulator, simulation.getLong("step-minutes"), simulation.getInt("steps"));
            }

            out.printf("Run %s: %d steps, %d minutes%n", result.status(), result.stepsCompleted(),
                result.minutesSimulated());
            WorldReport.printSummary(out, world);
            if (printEntities) {
                WorldReport.printEntities(out, world);
            }
            if (eventCount > 0) {
                out.println("Recent events:");
                WorldReport.printEvents(out, world.recentEvents(eventCount));
            }
            if (saveName != null) {
                out.println("Saved to " + stateManager.save(world, saveName));
            }
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (CorruptDataException | VersionMismatchException e) {
            err.println("World data is unusable: " + e.getMessage());
            return 3;
        } catch (IOException e) {
            err.println("I/O failure: " + e.getMessage());
            return 1;
        }
    }

    // Ctrl-C stops the run between two steps so that the summary and the save still happen.
    private RunResult runInterruptibly(Simulator simulator, long minutes, int stepCount) throws CorruptDataException {
        CancellationToken token = new CancellationToken();
        Thread hook = new Thread(() -> {
            LOG.info("Interrupt received, stopping after the current step");
            token.cancel();
        }, "SimulateShutdownHook");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return simulator.run(minutes, stepCount, token);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                LOG.debug("JVM is shutting down, hook stays registered");
            }
        }
    }

    private Map<String, Object> overrides() {
        Map<String, Object> overrides = new LinkedHashMap<>();
        putIfSet(overrides, "rgen.simulation.seed", seed);
        putIfSet(overrides, "rgen.simulation.world-name", worldName);
        putIfSet(overrides, "rgen.simulation.location-count", locationCount);
        putIfSet(overrides, "rgen.simulation.npc-count", npcCount);
        putIfSet(overrides, "rgen.simulation.steps", steps);
        putIfSet(overrides, "rgen.simulation.step-minutes", stepMinutes);
        putIfSet(overrides, "rgen.persistence.format", format);
        putIfSet(overrides, "rgen.persistence.compression.enabled", compress);
        putIfSet(overrides, "rgen.persistence.save-directory", saveDirectory == null ? null : saveDirectory.toString());
        putIfSet(overrides, "rgen.persistence.autosave.enabled", autosave);
        return overrides;
    }

    private static void putIfSet(Map<String, Object> map, String path, Object value) {
        if (value != null) {
            map.put(path, value);
        }
    }
}
