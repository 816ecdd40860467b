package ink.localiser.patch;

import static org.assertj.core.api.Assertions.assertThat;

import ink.localiser.script.DefaultSourceFileHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatchApplierTest {

    @TempDir
    Path tempDir;

    private static PendingEdit edit(int column, String locId) {
        return new PendingEdit("main.ink", 1, column, locId);
    }

    @Test
    void insertsWithLeadingSpaceAfterText() {
        assertThat(PatchApplier.applyEdit("Hello world", edit(11, "main_ABCD")))
                .contains("Hello world #loc:main_ABCD");
    }

    @Test
    void insertsWithoutExtraSpaceAfterWhitespace() {
        assertThat(PatchApplier.applyEdit("Hello world  ", edit(12, "main_ABCD")))
                .contains("Hello world #loc:main_ABCD ");
    }

    @Test
    void keepsFollowingTagSeparated() {
        assertThat(PatchApplier.applyEdit("Hello#mood: happy", edit(5, "main_ABCD")))
                .contains("Hello #loc:main_ABCD #mood: happy");
    }

    @Test
    void replacesOnlyTheFirstExistingLocTag() {
        assertThat(PatchApplier.applyEdit("Hi #loc:old_ONE #loc:old_TWO", edit(2, "main_NEW1")))
                .contains("Hi #loc:main_NEW1 #loc:old_TWO");
    }

    @Test
    void rejectsEditsThatDoNotFitTheLine() {
        assertThat(PatchApplier.applyEdit("Hi #loc: broken", edit(2, "main_ABCD"))).isEmpty();
        assertThat(PatchApplier.applyEdit("Hi", edit(10, "main_ABCD"))).isEmpty();
    }

    @Test
    void overwritesOriginalWhenDebugOutputIsOff() throws Exception {
        Files.writeString(tempDir.resolve("main.ink"), "Line one\nLine two\n", StandardCharsets.UTF_8);
        PatchApplier applier = new PatchApplier(new DefaultSourceFileHandler(tempDir), false, ".txt");

        PatchOutcome outcome = applier.apply(List.of(new FilePatch("main.ink", List.of(
                new PendingEdit("main.ink", 1, 8, "main_AAAA"),
                new PendingEdit("main.ink", 2, 8, "main_BBBB")))));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(Files.readString(tempDir.resolve("main.ink"), StandardCharsets.UTF_8))
                .isEqualTo("Line one #loc:main_AAAA\nLine two #loc:main_BBBB");
    }

    @Test
    void lineOutsideFileFailsThatFile() throws Exception {
        Files.writeString(tempDir.resolve("main.ink"), "Only line\n", StandardCharsets.UTF_8);
        PatchApplier applier = new PatchApplier(new DefaultSourceFileHandler(tempDir), true, ".txt");

        PatchOutcome outcome = applier.apply(List.of(new FilePatch("main.ink", List.of(
                new PendingEdit("main.ink", 5, 0, "main_AAAA")))));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failedFile()).contains("main.ink");
        assertThat(outcome.failure().orElseThrow()).contains("line 5");
        assertThat(Files.exists(tempDir.resolve("main.ink.txt"))).isFalse();
    }
}
