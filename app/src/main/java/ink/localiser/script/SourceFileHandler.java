package ink.localiser.script;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves and loads script files named relative to a source root.
 */
public interface SourceFileHandler {

    Path resolve(String fileName);

    String load(String fileName) throws IOException;
}
