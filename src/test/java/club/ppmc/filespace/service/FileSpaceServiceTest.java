package club.ppmc.filespace.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.filespace.exception.DuplicateFileSpaceNameException;
import club.ppmc.filespace.exception.InvalidNameException;
import club.ppmc.filespace.exception.NodeNotFoundException;
import club.ppmc.filespace.model.FileSpace;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class FileSpaceServiceTest {

    @Autowired
    private FileSpaceService fileSpaceService;

    private String owner;

    @BeforeEach
    void setUp() {
        owner = "owner-" + UUID.randomUUID();
    }

    @Test
    void namesAreUniquePerOwner() {
        fileSpaceService.create("Workspace", owner, "first");

        assertThatThrownBy(() -> fileSpaceService.create("Workspace", owner, null))
                .isInstanceOf(DuplicateFileSpaceNameException.class);

        FileSpace other = fileSpaceService.create("Workspace", "owner-" + UUID.randomUUID(), null);
        assertThat(other.getName()).isEqualTo("Workspace");
    }

    @Test
    void blankNamesAreRejected() {
        assertThatThrownBy(() -> fileSpaceService.create("  ", owner, null)).isInstanceOf(InvalidNameException.class);
    }

    @Test
    void renameKeepsOwnerUniqueness() {
        FileSpace a = fileSpaceService.create("A", owner, null);
        fileSpaceService.create("B", owner, null);

        assertThatThrownBy(() -> fileSpaceService.rename(a.getId(), "B"))
                .isInstanceOf(DuplicateFileSpaceNameException.class);

        assertThat(fileSpaceService.rename(a.getId(), "C").getName()).isEqualTo("C");
        assertThat(fileSpaceService.get(a.getId()).getName()).isEqualTo("C");
    }

    @Test
    void provisionDefaultIsIdempotentPerAgent() {
        FileSpace first = fileSpaceService.provisionDefault("Scout", owner);
        FileSpace again = fileSpaceService.provisionDefault("Scout", owner);

        assertThat(first.getName()).isEqualTo("Scout Files");
        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(fileSpaceService.listByOwner(owner)).hasSize(1);
    }

    @Test
    void longAgentNamesAreTruncatedToFit() {
        String name = fileSpaceService.defaultNameFor("x".repeat(300));

        assertThat(name).hasSize(128).endsWith(" Files");
    }

    @Test
    void unknownFileSpaceIsNotFound() {
        assertThatThrownBy(() -> fileSpaceService.get(UUID.randomUUID())).isInstanceOf(NodeNotFoundException.class);
    }
}
