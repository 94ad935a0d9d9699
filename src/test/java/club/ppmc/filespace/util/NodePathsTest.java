package club.ppmc.filespace.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class NodePathsTest {

    @Test
    void joinBuildsAbsolutePath() {
        assertThat(NodePaths.join(List.of("a"))).isEqualTo("/a");
        assertThat(NodePaths.join(List.of("a", "b", "c.txt"))).isEqualTo("/a/b/c.txt");
    }

    @Test
    void childPrefixAlwaysEndsWithSingleSeparator() {
        assertThat(NodePaths.childPrefix("/a/b")).isEqualTo("/a/b/");
        assertThat(NodePaths.childPrefix("/a/b/")).isEqualTo("/a/b/");
    }

    @Test
    void descendantPatternEscapesLikeWildcards() {
        assertThat(NodePaths.descendantPattern("/a")).isEqualTo("/a/%");
        assertThat(NodePaths.descendantPattern("/50%_off")).isEqualTo("/50!%!_off/%");
        assertThat(NodePaths.descendantPattern("/wow!")).isEqualTo("/wow!!/%");
    }
}
