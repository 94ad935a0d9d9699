package club.ppmc.filespace.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;

import club.ppmc.filespace.exception.NodeNotFoundException;
import club.ppmc.filespace.exception.StorageException;
import club.ppmc.filespace.exception.UnsupportedNodeOperationException;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.NodeContent;
import club.ppmc.filespace.model.NodeType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class ContentStorageTest {

    private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);
    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @MockBean
    private BlobStore blobStore;

    @Autowired
    private FileSpaceService fileSpaceService;

    @Autowired
    private FsNodeService nodeService;

    private UUID fs;

    @BeforeEach
    void setUp() {
        reset(blobStore);
        fs = fileSpaceService.create("Blobs", "owner-" + UUID.randomUUID(), null).getId();
    }

    @Test
    void writeContentRecordsMetadataAndStoresBytes() throws IOException {
        FsNode node = nodeService.create(fs, null, NodeType.FILE, "greeting.txt", null, null);

        FsNode written = nodeService.writeContent(node.getId(), new NodeContent("hello world.txt", HELLO, "text/plain"));

        String expectedKey = "agent_fs/" + fs + "/" + node.getId() + "/hello_world.txt";
        assertThat(written.getContentKey()).isEqualTo(expectedKey);
        assertThat(written.getSizeBytes()).isEqualTo(5L);
        assertThat(written.getMimeType()).isEqualTo("text/plain");
        assertThat(written.getChecksum()).isEqualTo(HELLO_SHA256);
        verify(blobStore).put(eq(expectedKey), eq(HELLO));
    }

    @Test
    void createWithContentStoresUnderNodeKey() throws IOException {
        FsNode node = nodeService.create(
                fs, null, NodeType.FILE, "data.csv", new NodeContent(null, HELLO, null), "agent-7");

        FsNode reloaded = nodeService.get(node.getId());
        assertThat(reloaded.getContentKey()).endsWith("/" + node.getId() + "/data.csv");
        assertThat(reloaded.getCreatedBy()).isEqualTo("agent-7");
        verify(blobStore).put(eq(reloaded.getContentKey()), any());
    }

    @Test
    void objectKeySurvivesRename() {
        FsNode node = nodeService.create(fs, null, NodeType.FILE, "a.txt", new NodeContent(null, HELLO, null), null);
        String before = nodeService.currentObjectKey(node.getId());

        nodeService.rename(node.getId(), "b.txt");

        assertThat(nodeService.currentObjectKey(node.getId())).isEqualTo(before);
    }

    @Test
    void replacingContentUnderNewNameDeletesPreviousBlob() throws IOException {
        FsNode node = nodeService.create(fs, null, NodeType.FILE, "v1.txt", new NodeContent(null, HELLO, null), null);
        String oldKey = nodeService.get(node.getId()).getContentKey();

        FsNode updated = nodeService.writeContent(node.getId(), new NodeContent("v2.txt", HELLO, null));

        assertThat(updated.getContentKey()).isNotEqualTo(oldKey);
        verify(blobStore).delete(oldKey);
    }

    @Test
    void blobFailureSurfacesAsStorageErrorAndRollsBackMetadata() throws IOException {
        FsNode node = nodeService.create(fs, null, NodeType.FILE, "report.pdf", null, null);
        doThrow(new IOException("bucket unavailable")).when(blobStore).put(any(), any());

        assertThatThrownBy(() -> nodeService.writeContent(node.getId(), new NodeContent(null, HELLO, null)))
                .isInstanceOf(StorageException.class)
                .hasCauseInstanceOf(IOException.class);

        FsNode reloaded = nodeService.get(node.getId());
        assertThat(reloaded.getContentKey()).isNull();
        assertThat(reloaded.getSizeBytes()).isNull();
    }

    @Test
    void failedCreateWithContentLeavesNoNode() throws IOException {
        doThrow(new IOException("bucket unavailable")).when(blobStore).put(any(), any());

        assertThatThrownBy(() -> nodeService.create(
                        fs, null, NodeType.FILE, "lost.txt", new NodeContent(null, HELLO, null), null))
                .isInstanceOf(StorageException.class);

        assertThatThrownBy(() -> nodeService.findByPath(fs, "/lost.txt")).isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    void directoriesRejectContentWrites() throws IOException {
        FsNode folder = nodeService.create(fs, null, NodeType.DIRECTORY, "folder", null, null);

        assertThatThrownBy(() -> nodeService.writeContent(folder.getId(), new NodeContent(null, HELLO, null)))
                .isInstanceOf(UnsupportedNodeOperationException.class);
        verify(blobStore, never()).put(any(), any());
    }
}
