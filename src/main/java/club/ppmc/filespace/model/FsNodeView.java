/**
 * FsNodeView.java
 *
 * 返回给前端的节点视图。与实体不同，它是不可变的，且不含任何延迟加载的关联。
 */
package club.ppmc.filespace.model;

import java.time.Instant;
import java.util.UUID;

public record FsNodeView(
        UUID id,
        UUID fileSpaceId,
        UUID parentId,
        String type,
        String name,
        String path,
        Long size,
        String mimeType,
        String checksum,
        boolean deleted,
        Instant deletedAt,
        Instant updatedAt) {

    public static FsNodeView of(FsNode node) {
        Instant deletedAt = node.getDeletionState() instanceof DeletionState.Deleted d ? d.at() : null;
        return new FsNodeView(
                node.getId(),
                node.getFileSpaceId(),
                node.getParentId(),
                node.isDirectory() ? "folder" : "file",
                node.getName(),
                node.getPath(),
                node.getSizeBytes(),
                node.getMimeType(),
                node.getChecksum(),
                node.isDeleted(),
                deletedAt,
                node.getUpdatedAt());
    }
}
