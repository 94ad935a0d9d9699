package club.ppmc.filespace.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.ImportedNode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AttachmentImportServiceTest {

    private static final LocalDate RECEIVED = LocalDate.of(2024, 5, 1);

    @Autowired
    private FileSpaceService fileSpaceService;

    @Autowired
    private FsNodeService nodeService;

    @Autowired
    private AttachmentImportService importService;

    private UUID fs;

    @BeforeEach
    void setUp() {
        fs = fileSpaceService.provisionDefault("Scout", "owner-" + UUID.randomUUID()).getId();
    }

    @Test
    void importsIntoDatedInboxAndDedupesNames() {
        byte[] pdf = "%PDF-1.4".getBytes(StandardCharsets.UTF_8);

        ImportedNode first = importService.importAttachment(fs, "report.pdf", pdf, "application/pdf", RECEIVED, "agent-1");
        ImportedNode second = importService.importAttachment(fs, "report.pdf", pdf, "application/pdf", RECEIVED, "agent-1");

        assertThat(first.path()).isEqualTo("/Inbox/2024-05-01/report.pdf");
        assertThat(second.filename()).isEqualTo("report (2).pdf");
        assertThat(second.path()).isEqualTo("/Inbox/2024-05-01/report (2).pdf");

        FsNode stored = nodeService.get(first.nodeId());
        assertThat(stored.getMimeType()).isEqualTo("application/pdf");
        assertThat(stored.getSizeBytes()).isEqualTo((long) pdf.length);
        assertThat(stored.getContentKey()).endsWith("/" + first.nodeId() + "/report.pdf");
    }

    @Test
    void missingFilenameFallsBackToAttachment() {
        ImportedNode imported = importService.importAttachment(fs, null, new byte[] {1, 2}, null, RECEIVED, null);

        assertThat(imported.filename()).isEqualTo("attachment");
        assertThat(nodeService.listChildren(fs, null)).extracting(FsNode::getName).containsExactly("Inbox");
    }

    @Test
    void pathComponentsInFilenameAreDropped() {
        ImportedNode imported = importService.importAttachment(
                fs, "../../secret/plan.txt", new byte[] {1}, "text/plain", RECEIVED, null);

        assertThat(imported.path()).isEqualTo("/Inbox/2024-05-01/plan.txt");
    }
}
