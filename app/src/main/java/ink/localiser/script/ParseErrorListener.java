package ink.localiser.script;

/**
 * Receives errors reported while parsing a script.
 */
@FunctionalInterface
public interface ParseErrorListener {

    void onError(String fileName, int lineNumber, String message);
}
