/**
 * PathCacheService.java
 *
 * 维护节点的缓存绝对路径。
 *
 * <p>节点的名称或父目录改变后，先沿祖先链重新计算节点自身的路径；如果节点是目录且路径发生变化，
 * 再用集合式 UPDATE 把子树中所有以旧路径 + '/' 开头的缓存路径改写为新路径 + '/'。
 * 子树成员沿 parent_id 逐层收集，每层一条查询，同名旧子树中的已删除节点不受影响。
 * 软删除级联依赖当前的缓存路径查找后代，因此改写必须在级联之前完成。</p>
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.exception.CycleDetectedException;
import club.ppmc.filespace.exception.InvalidNameException;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.repository.FsNodeRepository;
import club.ppmc.filespace.util.IdBatches;
import club.ppmc.filespace.util.NodePaths;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class PathCacheService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PathCacheService.class);

    private final FsNodeRepository nodeRepository;
    private final Clock clock;
    private final int maxDepth;

    public PathCacheService(
            FsNodeRepository nodeRepository, Clock clock, @Value("${filespace.max-depth:256}") int maxDepth) {
        this.nodeRepository = nodeRepository;
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    /**
     * 沿父指针向上遍历，用 '/' 拼接从根到节点的所有名称。
     *
     * @throws CycleDetectedException 祖先链超过最大深度时抛出（只有树已损坏时才会出现）。
     * @throws InvalidNameException 路径超过 {@link NodePaths#MAX_LENGTH} 个字符时抛出。
     */
    public String computePath(FsNode node) {
        Deque<String> names = new ArrayDeque<>();
        names.addFirst(node.getName());
        int depth = 0;
        for (FsNode cur = node.getParent(); cur != null; cur = cur.getParent()) {
            if (++depth > maxDepth) {
                throw new CycleDetectedException("祖先链超过最大深度 " + maxDepth + ": " + node.getId());
            }
            names.addFirst(cur.getName());
        }
        String path = NodePaths.join(List.copyOf(names));
        if (path.length() > NodePaths.MAX_LENGTH) {
            throw new InvalidNameException("路径不能超过 " + NodePaths.MAX_LENGTH + " 个字符: " + node.getName());
        }
        return path;
    }

    /**
     * 沿 parent_id 逐层向下收集目录的全部后代 ID（不含自身，不区分删除状态）。
     */
    public List<UUID> subtreeIds(FsNode directory) {
        List<UUID> result = new ArrayList<>();
        List<UUID> level = List.of(directory.getId());
        int depth = 0;
        while (!level.isEmpty()) {
            List<UUID> next = new ArrayList<>();
            for (List<UUID> batch : IdBatches.of(level)) {
                next.addAll(nodeRepository.findChildIds(batch));
            }
            if (!next.isEmpty() && ++depth > maxDepth) {
                throw new CycleDetectedException("子树超过最大深度 " + maxDepth + ": " + directory.getId());
            }
            result.addAll(next);
            level = next;
        }
        return result;
    }

    /**
     * 目录路径改变后批量改写所有后代的缓存路径。
     * 调用前节点自身的新路径必须已经写入数据库；调用后持久化上下文会被清空。
     *
     * @param directory 已更新路径的节点。
     * @param oldPath 修改前的路径。
     * @return 被改写的后代数量；节点不是目录或路径未变时为 0。
     * @throws InvalidNameException 改写后有后代路径超过 {@link NodePaths#MAX_LENGTH} 个字符。
     */
    public int rewriteDescendants(FsNode directory, String oldPath) {
        if (!directory.isDirectory() || oldPath == null || oldPath.equals(directory.getPath())) {
            return 0;
        }
        List<UUID> ids = subtreeIds(directory);
        if (ids.isEmpty()) {
            return 0;
        }
        String oldPrefix = NodePaths.childPrefix(oldPath);
        String newPrefix = NodePaths.childPrefix(directory.getPath());
        checkRewrittenLength(ids, newPrefix.length() - oldPrefix.length(), directory);

        String pattern = NodePaths.descendantPattern(oldPath);
        var now = clock.instant();
        int rewritten = 0;
        for (List<UUID> batch : IdBatches.of(ids)) {
            rewritten += nodeRepository.rewritePathPrefix(
                    directory.getFileSpaceId(), batch, pattern, newPrefix, oldPrefix.length() + 1, now);
        }
        LOGGER.info("已将 {} 个后代的路径前缀从 '{}' 改写为 '{}'", rewritten, oldPrefix, newPrefix);
        return rewritten;
    }

    private void checkRewrittenLength(List<UUID> ids, int growth, FsNode directory) {
        if (growth <= 0) {
            return;
        }
        int longest = 0;
        for (List<UUID> batch : IdBatches.of(ids)) {
            Integer max = nodeRepository.findMaxPathLength(batch);
            if (max != null) {
                longest = Math.max(longest, max);
            }
        }
        if (longest + growth > NodePaths.MAX_LENGTH) {
            throw new InvalidNameException(
                    "移动后 '" + directory.getPath() + "' 下的路径将超过 " + NodePaths.MAX_LENGTH + " 个字符。");
        }
    }
}
