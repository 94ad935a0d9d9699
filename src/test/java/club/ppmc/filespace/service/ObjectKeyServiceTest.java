package club.ppmc.filespace.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.filespace.model.FileSpace;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.NodeType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ObjectKeyServiceTest {

    private final ObjectKeyService keys = new ObjectKeyService("agent_fs");
    private final FileSpace fileSpace = new FileSpace("Work", "owner-1", null, Instant.now());

    @Test
    void keyIsComposedOfFileSpaceNodeAndSanitizedName() {
        var node = new FsNode(fileSpace, null, NodeType.FILE, "Quarterly Report.pdf", null, Instant.now());

        assertThat(keys.objectKey(node, null))
                .isEqualTo("agent_fs/" + fileSpace.getId() + "/" + node.getId() + "/Quarterly_Report.pdf");
    }

    @Test
    void explicitFilenameWinsOverNodeName() {
        var node = new FsNode(fileSpace, null, NodeType.FILE, "renamed.txt", null, Instant.now());

        assertThat(keys.objectKey(node, "/tmp/upload/original.csv")).endsWith("/" + node.getId() + "/original.csv");
    }

    @Test
    void fallsBackToFileWhenNoNameSurvives() {
        var node = new FsNode(fileSpace, null, NodeType.FILE, "", null, Instant.now());

        assertThat(keys.objectKey(node, null)).endsWith("/" + node.getId() + "/file");
        assertThat(keys.objectKey(node, "///")).endsWith("/file");
    }

    @Test
    void sameArgumentsGiveSameKey() {
        var node = new FsNode(fileSpace, null, NodeType.FILE, "a.txt", null, Instant.now());

        assertThat(keys.objectKey(node, "data.bin")).isEqualTo(keys.objectKey(node, "data.bin"));
    }

    @Test
    void storedKeyTakesPrecedenceOverCandidate() {
        var node = new FsNode(fileSpace, null, NodeType.FILE, "a.txt", null, Instant.now());
        node.setContentKey("agent_fs/legacy/key.txt");

        assertThat(keys.currentKey(node)).isEqualTo("agent_fs/legacy/key.txt");
    }
}
