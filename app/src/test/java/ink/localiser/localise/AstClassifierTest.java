package ink.localiser.localise;

import static org.assertj.core.api.Assertions.assertThat;

import ink.localiser.script.DefaultSourceFileHandler;
import ink.localiser.script.ScriptNode;
import ink.localiser.script.ScriptParser;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class AstClassifierTest {

    private final ScriptParser parser = new ScriptParser(new DefaultSourceFileHandler(Path.of(".")),
            (fileName, line, message) -> {
                throw new AssertionError(fileName + ":" + line + " " + message);
            });
    private final AstClassifier classifier = new AstClassifier();

    @Test
    void keepsOnlyLocalisableTextInDocumentOrder() {
        ScriptNode story = parser.parse("main.ink", """
                === intro ===
                Hello world #speaker: Ann
                VAR mood = "grumpy"
                {"interpolated"}

                Goodbye #loc:main_intro_ABCD
                """);
        VisitedFileSet visited = new VisitedFileSet();

        Classification classification = classifier.classify(story, visited);

        assertThat(classification.isConflict()).isFalse();
        assertThat(classification.runs()).extracting(TextRun::text).containsExactly("Hello world", "Goodbye");
        assertThat(classification.runs()).extracting(TextRun::startLine).containsExactly(2, 6);
        assertThat(classification.runs().get(0).fileId()).isEqualTo("main");
        assertThat(visited.fileIds()).containsExactly("main");
    }

    @Test
    void twoRunsOnOneLineIsAConflict() {
        ScriptNode story = parser.parse("main.ink", """
                First line
                You have {coins} coins
                """);
        VisitedFileSet visited = new VisitedFileSet();

        Classification classification = classifier.classify(story, visited);

        assertThat(classification.isConflict()).isTrue();
        assertThat(classification.conflict()).get()
                .extracting(Classification.LineConflict::lineNumber).isEqualTo(2);
        assertThat(classification.conflict().get().message()).contains("line 2");
        assertThat(visited.fileIds()).isEmpty();
    }

    @Test
    void filesVisitedByEarlierDocumentsAreSkipped() {
        VisitedFileSet visited = new VisitedFileSet();
        visited.addAll(java.util.List.of("shared"));
        ScriptNode story = parser.parse("shared.ink", "Shared text\nMore shared text\n");

        Classification classification = classifier.classify(story, visited);

        assertThat(classification.isConflict()).isFalse();
        assertThat(classification.runs()).isEmpty();
        assertThat(classification.newFileIds()).isEmpty();
    }

    @Test
    void lineConflictIsCheckedBeforeVisitedFiles() {
        VisitedFileSet visited = new VisitedFileSet();
        visited.addAll(java.util.List.of("shared"));
        ScriptNode story = parser.parse("shared.ink", "A {x} B\n");

        assertThat(classifier.classify(story, visited).isConflict()).isTrue();
    }
}
