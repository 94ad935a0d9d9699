/**
 * FileSpace.java
 *
 * 一个 filespace 是某个所有者名下的命名空间根，智能体把它当作持久的工作目录使用。
 * 同一所有者下名称唯一。创建后除了重命名不会被修改。
 */
package club.ppmc.filespace.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "agent_filespace",
        uniqueConstraints = @UniqueConstraint(name = "unique_filespace_per_owner_name", columnNames = {"owner_id", "name"}),
        indexes = @Index(name = "afs_owner_recent_idx", columnList = "owner_id, created_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FileSpace {

    @Id
    private UUID id;

    @Version
    private Long version;

    @Setter
    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Setter
    @Column(length = 2048)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Setter
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public FileSpace(String name, String ownerId, String description, Instant now) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.ownerId = ownerId;
        this.description = description;
        this.createdAt = now;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return "FileSpace<" + name + "> (" + id + ")";
    }
}
