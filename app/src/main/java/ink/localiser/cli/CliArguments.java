package ink.localiser.cli;

import ink.localiser.config.LogFormat;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ink-localiser", mixinStandardHelpOptions = true,
        description = "Adds stable #loc: IDs to every line of text in ink scripts")
public class CliArguments {

    @CommandLine.Option(names = "--folder", description = "Root folder of the scripts (default: current directory)", paramLabel = "DIR")
    private String folder;

    @CommandLine.Option(names = "--file-pattern", description = "Glob selecting scripts under the root (default: **.ink)", paramLabel = "GLOB")
    private String filePattern;

    @CommandLine.Option(names = "--retag", description = "Give every line a fresh ID, replacing existing ones")
    private boolean retagAll;

    @CommandLine.Option(names = "--debug-output", negatable = true,
            description = "Write rewritten scripts next to the originals using the debug suffix (default: on)")
    private Boolean debugOutput;

    @CommandLine.Option(names = "--debug-suffix", description = "Suffix for debug output files (default: .txt)", paramLabel = "SUFFIX")
    private String debugSuffix;

    @CommandLine.Option(names = "--id-length", description = "Number of random characters in new IDs (default: 4)", paramLabel = "COUNT")
    private Integer idLength;

    @CommandLine.Option(names = "--seed", description = "Seed for ID generation, for reproducible output", paramLabel = "SEED")
    private Long seed;

    @CommandLine.Option(names = "--stage", description = "Stage rewritten scripts when the folder is a git work tree")
    private boolean stage;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(arity = "0..*", paramLabel = "FILE", description = "Scripts to process, relative to the folder; replaces discovery")
    private List<String> files = new ArrayList<>();

    public String folder() {
        return folder;
    }

    public String filePattern() {
        return filePattern;
    }

    public boolean retagAll() {
        return retagAll;
    }

    public Boolean debugOutput() {
        return debugOutput;
    }

    public String debugSuffix() {
        return debugSuffix;
    }

    public Integer idLength() {
        return idLength;
    }

    public Long seed() {
        return seed;
    }

    public boolean stage() {
        return stage;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> files() {
        return files;
    }
}
