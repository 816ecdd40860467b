package ink.localiser.patch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class PatchPlannerTest {

    @Test
    void groupsEditsByFileInDiscoveryOrder() {
        PendingEdit chapterFirst = new PendingEdit("chapter.ink", 4, 3, "chapter_AAAA");
        PendingEdit main = new PendingEdit("main.ink", 2, 5, "main_BBBB");
        PendingEdit chapterSecond = new PendingEdit("chapter.ink", 1, 7, "chapter_CCCC");

        List<FilePatch> patches = new PatchPlanner().plan(List.of(chapterFirst, main, chapterSecond));

        assertThat(patches).extracting(FilePatch::fileName).containsExactly("chapter.ink", "main.ink");
        assertThat(patches.get(0).edits()).containsExactly(chapterFirst, chapterSecond);
        assertThat(patches.get(1).edits()).containsExactly(main);
    }

    @Test
    void noEditsMeansNoPatches() {
        assertThat(new PatchPlanner().plan(List.of())).isEmpty();
    }
}
