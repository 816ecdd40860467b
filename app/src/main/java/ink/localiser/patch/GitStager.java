package ink.localiser.patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages rewritten scripts when the source root is a git work tree.
 */
public class GitStager {

    private static final Logger LOGGER = LoggerFactory.getLogger(GitStager.class);

    private final Path root;

    public GitStager(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    /**
     * @return false when the root is not a repository and nothing was staged
     */
    public boolean stage(Path file) throws IOException {
        if (!Files.isDirectory(root.resolve(".git"))) {
            LOGGER.debug("{} is not a git work tree; skipping staging", root);
            return false;
        }
        String relativePath = root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
        try (Git git = Git.open(root.toFile())) {
            git.add().addFilepattern(relativePath).call();
        } catch (GitAPIException ex) {
            throw new IOException("Failed to stage " + relativePath, ex);
        }
        LOGGER.debug("Staged {}", relativePath);
        return true;
    }
}
