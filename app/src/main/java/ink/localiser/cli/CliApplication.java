package ink.localiser.cli;

import ink.localiser.config.Config;
import ink.localiser.config.ConfigLoader;
import ink.localiser.config.SystemEnvironmentReader;
import ink.localiser.localise.Localiser;
import ink.localiser.localise.LocaliserResult;
import ink.localiser.logging.LoggingConfigurator;
import ink.localiser.patch.GitStager;
import ink.localiser.script.DefaultSourceFileHandler;
import ink.localiser.script.ScriptDiscovery;
import java.io.IOException;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and localiser.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_RUN_FAILED = 1;

    private final ConfigLoader configLoader;
    private final ScriptDiscovery scriptDiscovery;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ScriptDiscovery());
    }

    CliApplication(ConfigLoader configLoader, ScriptDiscovery scriptDiscovery) {
        this.configLoader = configLoader;
        this.scriptDiscovery = scriptDiscovery;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Localising scripts under {} (retag={}, debugOutput={})",
                config.folder().toAbsolutePath(), config.retagAll(), config.debugOutput());

        DefaultSourceFileHandler fileHandler = new DefaultSourceFileHandler(config.folder());
        List<String> scripts;
        try {
            scripts = config.files().isEmpty()
                    ? scriptDiscovery.discover(fileHandler.root(), config.filePattern())
                    : config.files();
        } catch (IOException ex) {
            LOGGER.error("Could not list scripts under {}: {}", fileHandler.root(), ex.getMessage());
            return EXIT_RUN_FAILED;
        }
        if (scripts.isEmpty()) {
            LOGGER.warn("No scripts matching {} under {}", config.filePattern(), fileHandler.root());
        }

        GitStager gitStager = config.stageChanges() ? new GitStager(fileHandler.root()) : null;
        Localiser localiser = new Localiser(config.localiserOptions(), fileHandler, createRandom(config), gitStager);
        scripts.forEach(localiser::addFile);

        LocaliserResult result = localiser.run();
        if (!result.success()) {
            LOGGER.error("Localisation failed: {}", result.message());
            return EXIT_RUN_FAILED;
        }
        LOGGER.info("Collected {} strings from {} scripts; rewrote {} files",
                result.strings().size(), scripts.size(), result.writtenFiles().size());
        return 0;
    }

    private static RandomGenerator createRandom(Config config) {
        return config.seed()
                .<RandomGenerator>map(Random::new)
                .orElseGet(Random::new);
    }
}
