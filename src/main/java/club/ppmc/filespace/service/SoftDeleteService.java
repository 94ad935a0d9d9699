/**
 * SoftDeleteService.java
 *
 * 软删除（回收站）的级联处理。
 * 目录被删除或恢复时，沿 parent_id 收集子树成员，再按缓存路径前缀一次性批量更新。
 * 调用方必须保证传入节点的路径已经是最新的（见 PathCacheService），否则级联会漏掉节点。
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.exception.NameConflictException;
import club.ppmc.filespace.model.DeletionState;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.repository.FsNodeRepository;
import club.ppmc.filespace.util.IdBatches;
import club.ppmc.filespace.util.NodePaths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SoftDeleteService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SoftDeleteService.class);

    private final FsNodeRepository nodeRepository;
    private final PathCacheService pathCacheService;
    private final Clock clock;

    public SoftDeleteService(FsNodeRepository nodeRepository, PathCacheService pathCacheService, Clock clock) {
        this.nodeRepository = nodeRepository;
        this.pathCacheService = pathCacheService;
        this.clock = clock;
    }

    /**
     * 把节点标记为已删除；如果是目录，把所有仍存活的后代以同一时间戳标记为已删除。
     *
     * <p>幂等：节点已处于删除状态时保留原删除时间，但仍会补删上次未完成时遗留的存活后代，
     * 并使用节点原有的删除时间。</p>
     *
     * @return 实际被标记的行数；对存活节点即 1 + 后代数。
     */
    public int trash(FsNode node) {
        Instant at = node.getDeletionState() instanceof DeletionState.Deleted d ? d.at() : clock.instant();
        String path = node.getPath();
        List<UUID> subtree = node.isDirectory() ? pathCacheService.subtreeIds(node) : List.of();

        int self = nodeRepository.markDeleted(node.getId(), at);
        int descendants = 0;
        String pattern = NodePaths.descendantPattern(path);
        for (List<UUID> batch : IdBatches.of(subtree)) {
            descendants += nodeRepository.markLiveDescendantsDeleted(node.getFileSpaceId(), batch, pattern, at);
        }
        LOGGER.info("已将 '{}' 移入回收站，本节点 {} 行，后代 {} 行", path, self, descendants);
        return self + descendants;
    }

    /**
     * 清除节点的删除状态；如果是目录，同时清除所有已删除后代的删除状态。
     * 祖先仍处于删除状态时也允许恢复，只是在祖先恢复之前无法通过正常遍历访问到它。
     *
     * <p>节点自身的重名检查由调用方完成；这里检查被恢复的后代，
     * 任何一个与同目录下的存活节点或另一个被恢复的节点重名时整体失败，不做任何修改。</p>
     *
     * @return 实际被恢复的行数。
     * @throws NameConflictException 恢复会在某个目录下产生两个同名的存活节点。
     */
    public int restore(FsNode node) {
        String path = node.getPath();
        List<UUID> subtree = node.isDirectory() ? pathCacheService.subtreeIds(node) : List.of();
        checkRestoredNamesAreFree(subtree);

        Instant now = clock.instant();
        int self = nodeRepository.markRestored(node.getId(), now);
        int descendants = 0;
        String pattern = NodePaths.descendantPattern(path);
        for (List<UUID> batch : IdBatches.of(subtree)) {
            descendants += nodeRepository.markDeletedDescendantsRestored(node.getFileSpaceId(), batch, pattern, now);
        }
        LOGGER.info("已从回收站恢复 '{}'，本节点 {} 行，后代 {} 行", path, self, descendants);
        return self + descendants;
    }

    private void checkRestoredNamesAreFree(List<UUID> subtree) {
        List<FsNode> restoring = new ArrayList<>();
        for (List<UUID> batch : IdBatches.of(subtree)) {
            restoring.addAll(nodeRepository.findByIdInAndDeletedTrue(batch));
        }
        if (restoring.isEmpty()) {
            return;
        }

        Set<UUID> parents = restoring.stream().map(FsNode::getParentId).collect(Collectors.toSet());
        Set<String> taken = new HashSet<>();
        for (List<UUID> batch : IdBatches.of(parents)) {
            nodeRepository.findByParentIdInAndDeletedFalse(batch).forEach(live -> taken.add(siblingKey(live)));
        }
        for (FsNode candidate : restoring) {
            if (!taken.add(siblingKey(candidate))) {
                throw new NameConflictException("恢复后 '" + candidate.getPath() + "' 会与同目录下的节点重名。");
            }
        }
    }

    // 名称不含 '/'，拼接结果不会有歧义
    private static String siblingKey(FsNode node) {
        return node.getParentId() + NodePaths.SEPARATOR + node.getName();
    }
}
