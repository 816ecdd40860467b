package ink.localiser.script;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptParserTest {

    @TempDir
    Path tempDir;

    private final List<String> errors = new ArrayList<>();

    private ScriptParser parser() {
        return new ScriptParser(new DefaultSourceFileHandler(tempDir),
                (fileName, line, message) -> errors.add(fileName + ":" + line + " " + message));
    }

    @Test
    void buildsKnotAndStitchScopesAroundContentLines() {
        ScriptNode story = parser().parse("main.ink", """
                === intro ===
                Hello world
                = part_two
                Bonjour #loc:main_XXXX
                """);

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = story.findAll(NodeKind.TEXT);
        assertThat(texts).extracting(ScriptNode::text)
                .containsExactly("Hello world", "\n", "Bonjour", "loc:main_XXXX", "\n");

        ScriptNode hello = texts.get(0);
        assertThat(hello.position().startLine()).isEqualTo(2);
        assertThat(hello.position().endColumn()).isEqualTo(11);
        assertThat(hello.ancestry()).extracting(ScriptNode::kind)
                .containsExactly(NodeKind.STORY, NodeKind.KNOT, NodeKind.LINE);

        ScriptNode bonjour = texts.get(2);
        assertThat(bonjour.position().endColumn()).isEqualTo(7);
        assertThat(bonjour.ancestry()).extracting(node -> node.name().orElse(""))
                .containsExactly("", "intro", "part_two", "");
        assertThat(bonjour.siblings()).extracting(ScriptNode::kind)
                .containsExactly(NodeKind.TEXT, NodeKind.TAG_START, NodeKind.TEXT, NodeKind.TAG_END, NodeKind.TEXT);
    }

    @Test
    void stringLiteralsInCodeBecomeChildrenOfCodeContexts() {
        ScriptNode story = parser().parse("main.ink", """
                VAR greeting = "Hi there"
                ~ temp name = "Bob" // a comment
                Say {"hello"} now
                """);

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = story.findAll(NodeKind.TEXT);
        assertThat(texts).extracting(ScriptNode::text)
                .containsExactly("Hi there", "Bob", "Say", "hello", " now", "\n");
        assertThat(texts.get(0).parent()).get().extracting(ScriptNode::kind).isEqualTo(NodeKind.VARIABLE_ASSIGNMENT);
        assertThat(texts.get(1).parent()).get().extracting(ScriptNode::kind).isEqualTo(NodeKind.VARIABLE_ASSIGNMENT);
        assertThat(texts.get(3).parent()).get().extracting(ScriptNode::kind).isEqualTo(NodeKind.STRING_EXPRESSION);
    }

    @Test
    void skipsChoiceBulletsLabelsAndTrailingDiverts() {
        ScriptNode story = parser().parse("main.ink", """
                * * (pick) Take the key -> vault
                - Carry on
                """);

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = story.findAll(NodeKind.TEXT);
        assertThat(texts.get(0).text()).isEqualTo("Take the key");
        assertThat(texts.get(0).position().endColumn()).isEqualTo("* * (pick) Take the key".length());
        assertThat(texts.get(0).siblings()).extracting(ScriptNode::kind)
                .containsExactly(NodeKind.TEXT, NodeKind.DIVERT, NodeKind.TEXT);
        assertThat(texts.get(2).text()).isEqualTo("Carry on");
    }

    @Test
    void commentsAndEscapesDoNotShiftColumns() {
        ScriptNode story = parser().parse("main.ink", "Price is 5\\# each // note\n");

        ScriptNode text = story.findAll(NodeKind.TEXT).get(0);
        assertThat(text.text()).isEqualTo("Price is 5# each");
        assertThat(text.position().endColumn()).isEqualTo("Price is 5\\# each".length());
    }

    @Test
    void parsesIncludedFilesRelativeToTheSourceRoot() throws Exception {
        Files.createDirectories(tempDir.resolve("chapters"));
        Files.writeString(tempDir.resolve("chapters/one.ink"), "First chapter\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("chapters/main.ink"),
                "INCLUDE chapters/one.ink\nINCLUDE chapters/one.ink\nMain text\n", StandardCharsets.UTF_8);

        ScriptNode story = parser().parse("chapters/main.ink");

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = visibleTextNodes(story);
        assertThat(texts).extracting(node -> node.position().fileName() + ":" + node.position().startLine())
                .containsExactly("chapters/one.ink:1", "chapters/main.ink:3");
        assertThat(texts.get(0).position().fileId()).isEqualTo("one");
    }

    @Test
    void reportsErrorsAndKeepsParsing() {
        parser().parse("main.ink", """
                === bad name! ===
                Hello {unclosed
                INCLUDE missing.ink
                Go ->
                """);

        assertThat(errors).hasSize(4);
        assertThat(errors.get(0)).startsWith("main.ink:1").contains("bad name!");
        assertThat(errors.get(1)).startsWith("main.ink:3").contains("missing.ink");
        assertThat(errors.get(2)).startsWith("main.ink:4").contains("target");
        assertThat(errors.get(3)).startsWith("main.ink:2").contains("Unterminated block");
    }

    @Test
    void listExternalTodoAndThreadLinesCarryNoText() {
        ScriptNode story = parser().parse("main.ink", """
                LIST colours = red, green
                EXTERNAL play(x)
                TODO: tidy this knot
                <- thread
                Plain
                """);

        assertThat(errors).isEmpty();
        assertThat(visibleTextNodes(story)).extracting(ScriptNode::text).containsExactly("Plain");
        assertThat(story.findAll(NodeKind.VARIABLE_ASSIGNMENT)).hasSize(1);
        assertThat(story.findAll(NodeKind.DIVERT)).hasSize(1);
    }

    @Test
    void multiLineBlocksYieldTheirBranchContent() {
        ScriptNode story = parser().parse("main.ink", """
                { flag:
                    Yes
                - else:
                    No
                }
                { coins:
                - 0: Broke
                - else: Rich
                }
                { stopping:
                - First time
                - After that
                }
                After
                """);

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = visibleTextNodes(story);
        assertThat(texts).extracting(ScriptNode::text)
                .containsExactly("Yes", "No", "Broke", "Rich", "First time", "After that", "After");
        assertThat(texts.get(0).position().endColumn()).isEqualTo("    Yes".length());
        assertThat(texts.get(2).position().endColumn()).isEqualTo("- 0: Broke".length());
    }

    @Test
    void blockCommentsAreIgnoredAcrossLines() {
        ScriptNode story = parser().parse("main.ink", """
                /*
                  A note
                */
                Hello /* aside */
                Visible
                """);

        assertThat(errors).isEmpty();
        List<ScriptNode> texts = visibleTextNodes(story);
        assertThat(texts).extracting(ScriptNode::text).containsExactly("Hello", "Visible");
        assertThat(texts.get(0).position().endColumn()).isEqualTo(5);
    }

    @Test
    void choiceBracketsAreDroppedFromTextButNotFromColumns() {
        ScriptNode story = parser().parse("main.ink", """
                * Hello [there] friend -> next
                * [Go]
                """);

        List<ScriptNode> texts = visibleTextNodes(story);
        assertThat(texts).extracting(ScriptNode::text).containsExactly("Hello there friend", "Go");
        assertThat(texts.get(0).position().endColumn()).isEqualTo("* Hello [there] friend".length());
        assertThat(texts.get(1).position().endColumn()).isEqualTo("* [Go]".length());
    }

    @Test
    void unclosedBlockCommentIsReported() {
        parser().parse("main.ink", "Text\n/* never closed\nMore\n");

        assertThat(errors).containsExactly("main.ink:2 Unterminated block comment");
    }

    private static List<ScriptNode> visibleTextNodes(ScriptNode story) {
        return story.findAll(NodeKind.TEXT).stream()
                .filter(node -> !node.text().isBlank())
                .toList();
    }
}
