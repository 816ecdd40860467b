package ink.localiser.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads script files from the local file system as UTF-8.
 */
public class DefaultSourceFileHandler implements SourceFileHandler {

    private final Path root;

    public DefaultSourceFileHandler(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public Path resolve(String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        return root.resolve(fileName).normalize();
    }

    @Override
    public String load(String fileName) throws IOException {
        return Files.readString(resolve(fileName), StandardCharsets.UTF_8);
    }
}
