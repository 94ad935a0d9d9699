/**
 * FsNodeRepository.java
 *
 * FsNode 的持久化接口。
 *
 * <p>子树成员先沿 parent_id 逐层收集 ID（见 {@link #findChildIds}），
 * 再用缓存路径前缀 ({@code path like '<prefix>/%'}) 加 ID 集合限定集合式 UPDATE。
 * 只按路径匹配会误伤同名的旧子树：旧目录被删除后新建同名目录，两者的后代共享同一个路径前缀。
 * 传入的 pattern 必须先经过 {@code NodePaths.descendantPattern} 转义，转义符为 '!'。</p>
 *
 * <p>所有批量更新都会先 flush 再清空持久化上下文，调用方之后必须重新加载实体。</p>
 */
package club.ppmc.filespace.repository;

import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.NodeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FsNodeRepository extends JpaRepository<FsNode, UUID> {

    // --- 列表与查找 ---

    List<FsNode> findByFileSpaceIdAndParentIdAndDeletedFalse(UUID fileSpaceId, UUID parentId);

    List<FsNode> findByFileSpaceIdAndParentIdIsNullAndDeletedFalse(UUID fileSpaceId);

    Optional<FsNode> findFirstByFileSpaceIdAndPathAndDeletedFalse(UUID fileSpaceId, String path);

    Optional<FsNode> findFirstByFileSpaceIdAndParentIdAndNameAndNodeTypeAndDeletedFalse(
            UUID fileSpaceId, UUID parentId, String name, NodeType nodeType);

    Optional<FsNode> findFirstByFileSpaceIdAndParentIdIsNullAndNameAndNodeTypeAndDeletedFalse(
            UUID fileSpaceId, String name, NodeType nodeType);

    // --- 唯一性 (仅存活节点) ---

    boolean existsByFileSpaceIdAndParentIdAndNameAndDeletedFalseAndIdNot(
            UUID fileSpaceId, UUID parentId, String name, UUID excludedId);

    boolean existsByFileSpaceIdAndParentIdIsNullAndNameAndDeletedFalseAndIdNot(
            UUID fileSpaceId, String name, UUID excludedId);

    // --- 子树 ---

    @Query("select n.fileSpaceId from FsNode n where n.id = :id")
    Optional<UUID> findFileSpaceIdById(@Param("id") UUID nodeId);

    /** 直接子节点的 ID，不区分删除状态。 */
    @Query("select n.id from FsNode n where n.parentId in :parentIds")
    List<UUID> findChildIds(@Param("parentIds") Collection<UUID> parentIds);

    List<FsNode> findByIdInAndDeletedTrue(Collection<UUID> ids);

    List<FsNode> findByParentIdInAndDeletedFalse(Collection<UUID> parentIds);

    @Query("select max(length(n.path)) from FsNode n where n.id in :ids")
    Integer findMaxPathLength(@Param("ids") Collection<UUID> ids);

    /**
     * 把指定节点中以旧前缀开头的缓存路径改写为新前缀。
     *
     * @param tailStart 旧前缀长度 + 1 (JPQL substring 从 1 开始计数)。
     * @return 被改写的行数。
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FsNode n set n.path = concat(:newPrefix, substring(n.path, :tailStart)),"
            + " n.version = n.version + 1, n.updatedAt = :now"
            + " where n.fileSpaceId = :fsId and n.id in :ids and n.path like :pattern escape '!'")
    int rewritePathPrefix(
            @Param("fsId") UUID fileSpaceId,
            @Param("ids") Collection<UUID> ids,
            @Param("pattern") String oldPattern,
            @Param("newPrefix") String newPrefix,
            @Param("tailStart") int tailStart,
            @Param("now") Instant now);

    // --- 软删除 ---

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FsNode n set n.deleted = true, n.deletedAt = :at, n.version = n.version + 1, n.updatedAt = :at"
            + " where n.id = :id and n.deleted = false")
    int markDeleted(@Param("id") UUID nodeId, @Param("at") Instant at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FsNode n set n.deleted = true, n.deletedAt = :at, n.version = n.version + 1, n.updatedAt = :at"
            + " where n.fileSpaceId = :fsId and n.deleted = false and n.id in :ids"
            + " and n.path like :pattern escape '!'")
    int markLiveDescendantsDeleted(
            @Param("fsId") UUID fileSpaceId,
            @Param("ids") Collection<UUID> ids,
            @Param("pattern") String pattern,
            @Param("at") Instant at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FsNode n set n.deleted = false, n.deletedAt = null, n.version = n.version + 1, n.updatedAt = :now"
            + " where n.id = :id and n.deleted = true")
    int markRestored(@Param("id") UUID nodeId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FsNode n set n.deleted = false, n.deletedAt = null, n.version = n.version + 1, n.updatedAt = :now"
            + " where n.fileSpaceId = :fsId and n.deleted = true and n.id in :ids"
            + " and n.path like :pattern escape '!'")
    int markDeletedDescendantsRestored(
            @Param("fsId") UUID fileSpaceId,
            @Param("ids") Collection<UUID> ids,
            @Param("pattern") String pattern,
            @Param("now") Instant now);
}
