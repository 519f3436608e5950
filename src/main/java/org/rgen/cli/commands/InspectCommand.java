package org.rgen.cli.commands;

import com.typesafe.config.Config;
import org.rgen.cli.CommandLineInterface;
import org.rgen.cli.WorldReport;
import org.rgen.generation.EntityFactory;
import org.rgen.generation.TemplateContentGenerator;
import org.rgen.runtime.SimulationParameters;
import org.rgen.runtime.World;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.persistence.PersistenceSettings;
import org.rgen.runtime.persistence.SaveInfo;
import org.rgen.runtime.persistence.StateManager;
import org.rgen.runtime.persistence.VersionMismatchException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "inspect",
    description = "List saves, or load one and print its summary, entities and recent events"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Name of the save to inspect; omit to list saves")
    private String saveName;

    @Option(names = "--save-dir", description = "Directory for saves (default: rgen.persistence.save-directory)")
    private Path saveDirectory;

    @Option(names = "--events", description = "Number of recent events to print (default: ${DEFAULT-VALUE})")
    private int eventCount = 20;

    @Option(names = "--entities", description = "Print every active entity")
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
            Config config = parent.getConfig();
            PersistenceSettings persistence = PersistenceSettings.fromConfig(config.getConfig("rgen.persistence"));
            if (saveDirectory != null) {
                persistence = persistence.withSaveDirectory(saveDirectory);
            }
            StateManager stateManager = new StateManager(persistence);

            if (saveName == null) {
                List<SaveInfo> saves = stateManager.listSaves();
                if (saves.isEmpty()) {
                    out.println("No saves in " + stateManager.getSaveDirectory());
                }
                for (SaveInfo save : saves) {
                    out.printf("  %-24s %10d bytes  %s  %s%n", save.name(), save.sizeBytes(), save.lastModified(),
                        save.path().getFileName());
                }
                return 0;
            }

            SimulationParameters parameters = SimulationParameters.fromConfig(config);
            World world = stateManager.load(saveName, parameters, new TemplateContentGenerator(),
                new EntityFactory(parameters.behavior()));
            WorldReport.printSummary(out, world);
            if (printEntities) {
                WorldReport.printEntities(out, world);
            }
            if (eventCount > 0) {
                out.println("Recent events:");
                WorldReport.printEvents(out, world.recentEvents(eventCount));
            }
            return 0;
        } catch (NoSuchFileException e) {
            err.println("No save named '" + saveName + "'");
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (CorruptDataException | VersionMismatchException e) {
            err.println("Save '" + saveName + "' is unusable: " + e.getMessage());
            return 3;
        } catch (IOException e) {
            err.println("I/O failure: " + e.getMessage());
            return 1;
        }
    }
}
