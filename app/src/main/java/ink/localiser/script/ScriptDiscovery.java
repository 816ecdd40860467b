package ink.localiser.script;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds scripts under a root folder whose relative path matches a glob.
 */
public class ScriptDiscovery {

    /**
     * @return matching file names relative to {@code root}, {@code /} separated and sorted
     */
    public List<String> discover(Path root, String glob) throws IOException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(glob, "glob");
        Path base = root.toAbsolutePath().normalize();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> paths = Files.walk(base)) {
            return paths.filter(Files::isRegularFile)
                    .map(base::relativize)
                    .filter(matcher::matches)
                    .map(path -> path.toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
