/**
 * FsNode.java
 *
 * filespace 中的单个节点（目录或文件），目录与文件共用同一张表。
 *
 * <p>树结构用父指针（邻接表）表示，同时缓存了一份从根开始的绝对路径 {@code path}，
 * 使列表和子树查询无需反复向上遍历祖先。路径缓存由 PathCacheService 维护，
 * 软删除状态没有 setter，只能通过 SoftDeleteService 的批量更新修改。</p>
 *
 * <p>{@code fileSpaceId} 与 {@code parentId} 是关联外键列的只读映射，用于派生查询和在事务外读取。</p>
 */
package club.ppmc.filespace.model;

import club.ppmc.filespace.util.NodeNames;
import club.ppmc.filespace.util.NodePaths;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "agent_fs_node",
        indexes = {
            @Index(name = "fs_list_idx", columnList = "filespace_id, parent_id, node_type, name"),
            @Index(name = "fs_path_idx", columnList = "filespace_id, path"),
            @Index(name = "fs_deleted_idx", columnList = "is_deleted")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FsNode {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Getter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "filespace_id", nullable = false, updatable = false)
    private FileSpace fileSpace;

    @Column(name = "filespace_id", insertable = false, updatable = false)
    private UUID fileSpaceId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private FsNode parent;

    @Column(name = "parent_id", insertable = false, updatable = false)
    private UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 16, updatable = false)
    private NodeType nodeType;

    @Setter
    @Column(nullable = false, length = NodeNames.MAX_LENGTH)
    private String name;

    /** 缓存的绝对路径，例如 /foo/bar/baz.txt */
    @Setter
    @Column(nullable = false, length = NodePaths.MAX_LENGTH)
    private String path;

    // --- 以下字段仅对文件有效 ---

    @Setter
    @Column(name = "content_key", length = 1024)
    private String contentKey;

    @Setter
    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Setter
    @Column(name = "mime_type", length = 127)
    private String mimeType;

    @Setter
    @Column(name = "checksum_sha256", length = 64)
    private String checksum;

    @Column(name = "created_by", length = 64, updatable = false)
    private String createdBy;

    @Getter(AccessLevel.NONE)
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Getter(AccessLevel.NONE)
    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Setter
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public FsNode(FileSpace fileSpace, FsNode parent, NodeType nodeType, String name, String createdBy, Instant now) {
        this.id = UUID.randomUUID();
        this.fileSpace = fileSpace;
        this.fileSpaceId = fileSpace.getId();
        this.nodeType = nodeType;
        this.name = name;
        this.createdBy = createdBy;
        this.createdAt = now;
        this.updatedAt = now;
        attachTo(parent);
    }

    /**
     * 修改父指针。null 表示移动到 filespace 根层级。
     * 调用方负责事先完成同 filespace、目录类型和环路校验。
     */
    public void attachTo(FsNode newParent) {
        this.parent = newParent;
        this.parentId = newParent != null ? newParent.getId() : null;
    }

    public DeletionState getDeletionState() {
        return DeletionState.of(deleted, deletedAt);
    }

    public boolean isDeleted() {
        return deleted;
    }

    public boolean isDirectory() {
        return nodeType.isDirectory();
    }

    public boolean isFile() {
        return nodeType == NodeType.FILE;
    }

    /** 清除所有仅属于文件的内容字段。 */
    public void clearContent() {
        this.contentKey = null;
        this.sizeBytes = null;
        this.mimeType = null;
        this.checksum = null;
    }

    @Override
    public String toString() {
        return (isDirectory() ? "DIR " : "FILE ") + (path != null ? path : name);
    }
}
