package ink.localiser.localise;

import ink.localiser.patch.FilePatch;
import ink.localiser.patch.GitStager;
import ink.localiser.patch.PatchApplier;
import ink.localiser.patch.PatchOutcome;
import ink.localiser.patch.PatchPlanner;
import ink.localiser.patch.PendingEdit;
import ink.localiser.script.ScriptNode;
import ink.localiser.script.ScriptParser;
import ink.localiser.script.SourceFileHandler;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the localisation pass over a set of scripts: parse and classify every script in turn,
 * allocate IDs, then write the missing tags back into the sources.
 *
 * <p>Parse errors and line conflicts stop the run before any file is touched. A failure while
 * rewriting stops the run where it happened. An instance performs a single run.
 */
public class Localiser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Localiser.class);

    private final LocaliserOptions options;
    private final SourceFileHandler fileHandler;
    private final AstClassifier classifier;
    private final PatchPlanner planner;
    private final PatchApplier applier;
    private final Set<String> scriptFiles = new LinkedHashSet<>();
    private final VisitedFileSet visitedFiles = new VisitedFileSet();
    private final StringTable strings = new StringTable();
    private final List<PendingEdit> pendingEdits = new ArrayList<>();
    private final LocationIdAllocator allocator;
    private boolean started;

    public Localiser(LocaliserOptions options, SourceFileHandler fileHandler, RandomGenerator random) {
        this(options, fileHandler, random, null);
    }

    /**
     * @param gitStager stages overwritten scripts, may be null
     */
    public Localiser(LocaliserOptions options, SourceFileHandler fileHandler, RandomGenerator random, GitStager gitStager) {
        this.options = Objects.requireNonNull(options, "options");
        this.fileHandler = Objects.requireNonNull(fileHandler, "fileHandler");
        this.classifier = new AstClassifier();
        this.planner = new PatchPlanner();
        this.applier = new PatchApplier(fileHandler, options.debugOutput(), options.debugSuffix(), gitStager);
        this.allocator = new LocationIdAllocator(random, options.idLength(), options.retagAll(), strings);
    }

    /**
     * Adds a script, named relative to the source root. Adding the same name twice has no effect.
     */
    public void addFile(String fileName) {
        scriptFiles.add(Objects.requireNonNull(fileName, "fileName"));
    }

    public LocaliserResult run() {
        if (started) {
            throw new IllegalStateException("Localiser instances perform a single run");
        }
        started = true;
        LOGGER.info("Localising {} scripts (retagAll={}, debugOutput={})",
                scriptFiles.size(), options.retagAll(), options.debugOutput());

        for (String scriptFile : scriptFiles) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable("file", scriptFile)) {
                Optional<LocaliserResult> failure = processScript(scriptFile);
                if (failure.isPresent()) {
                    return failure.get();
                }
            }
        }

        List<FilePatch> patches = planner.plan(pendingEdits);
        PatchOutcome outcome = applier.apply(patches);
        if (!outcome.isSuccess()) {
            return fail(FailureKind.FILE_IO_FAILURE, "Error replacing tags in " + outcome.failedFile().orElse("?")
                    + ": " + outcome.failure().orElse(""), outcome.writtenFiles());
        }

        LOGGER.info("Localised {} strings; {} tags written to {} files",
                strings.size(), pendingEdits.size(), outcome.writtenFiles().size());
        return LocaliserResult.succeeded(strings, outcome.writtenFiles());
    }

    private Optional<LocaliserResult> processScript(String scriptFile) {
        List<String> parseErrors = new ArrayList<>();
        ScriptParser parser = new ScriptParser(fileHandler,
                (fileName, line, message) -> parseErrors.add(fileName + ":" + line + ": " + message));
        ScriptNode story;
        try {
            story = parser.parse(scriptFile);
        } catch (IOException ex) {
            return Optional.of(fail(FailureKind.FILE_IO_FAILURE, "Could not read " + scriptFile + ": " + ex.getMessage(), List.of()));
        }
        if (!parseErrors.isEmpty()) {
            return Optional.of(fail(FailureKind.PARSE_FAILURE, "Error parsing ink file " + scriptFile + ": "
                    + String.join("; ", parseErrors), List.of()));
        }

        Classification classification = classifier.classify(story, visitedFiles);
        if (classification.isConflict()) {
            return Optional.of(fail(FailureKind.CLASSIFICATION_CONFLICT, classification.conflict().get().message(), List.of()));
        }
        LOGGER.debug("{} localisable lines in {}", classification.runs().size(), classification.newFileIds());

        for (TextRun run : classification.runs()) {
            allocator.allocate(run).edit().ifPresent(pendingEdits::add);
        }
        return Optional.empty();
    }

    public StringTable strings() {
        return strings;
    }

    private LocaliserResult fail(FailureKind kind, String message, List<Path> writtenFiles) {
        LOGGER.error("{}: {}", kind, message);
        return LocaliserResult.failed(kind, message, strings, writtenFiles);
    }
}
