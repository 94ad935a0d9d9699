/**
 * FsNodeService.java
 *
 * 该服务负责 filespace 内所有节点的结构性操作：创建、移动/重命名、删除与恢复、列表和子树查询，
 * 以及向文件节点写入内容。它是智能体虚拟文件系统的核心。
 *
 * <p>每个修改操作都在单个事务中完成，并先对所属 filespace 行加悲观写锁，
 * 使路径改写、级联和唯一性检查作为一个不可分割的整体被观察到。
 * 提交顺序固定为：校验 → 写入名称/父目录 → 重新计算自身路径 → 批量改写后代路径 → 删除/恢复级联。</p>
 *
 * <p>本层不做任何权限检查，调用方在调用前已经完成授权。</p>
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.exception.ConcurrencyConflictException;
import club.ppmc.filespace.exception.CycleDetectedException;
import club.ppmc.filespace.exception.InvalidParentException;
import club.ppmc.filespace.exception.NodeNotFoundException;
import club.ppmc.filespace.exception.StorageException;
import club.ppmc.filespace.exception.UnsupportedNodeOperationException;
import club.ppmc.filespace.model.FileSpace;
import club.ppmc.filespace.model.FsNode;
import club.ppmc.filespace.model.NodeChange;
import club.ppmc.filespace.model.NodeChangeResult;
import club.ppmc.filespace.model.NodeContent;
import club.ppmc.filespace.model.NodeType;
import club.ppmc.filespace.repository.FileSpaceRepository;
import club.ppmc.filespace.repository.FsNodeRepository;
import club.ppmc.filespace.util.IdBatches;
import club.ppmc.filespace.util.NodeNames;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class FsNodeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FsNodeService.class);

    /** 目录在前，文件在后，然后按名称（区分大小写）排序。 */
    private static final Comparator<FsNode> LISTING_ORDER =
            Comparator.comparing(FsNode::getNodeType).thenComparing(FsNode::getName);

    private final FsNodeRepository nodeRepository;
    private final FileSpaceRepository fileSpaceRepository;
    private final NameUniquenessGuard uniquenessGuard;
    private final PathCacheService pathCacheService;
    private final SoftDeleteService softDeleteService;
    private final ObjectKeyService objectKeyService;
    private final BlobStore blobStore;
    private final Clock clock;
    private final int maxDepth;

    public FsNodeService(
            FsNodeRepository nodeRepository,
            FileSpaceRepository fileSpaceRepository,
            NameUniquenessGuard uniquenessGuard,
            PathCacheService pathCacheService,
            SoftDeleteService softDeleteService,
            ObjectKeyService objectKeyService,
            BlobStore blobStore,
            Clock clock,
            @Value("${filespace.max-depth:256}") int maxDepth) {
        this.nodeRepository = nodeRepository;
        this.fileSpaceRepository = fileSpaceRepository;
        this.uniquenessGuard = uniquenessGuard;
        this.pathCacheService = pathCacheService;
        this.softDeleteService = softDeleteService;
        this.objectKeyService = objectKeyService;
        this.blobStore = blobStore;
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    // ========================= 查询 =========================

    @Transactional(readOnly = true)
    public FsNode get(UUID nodeId) {
        return loadNode(nodeId);
    }

    /**
     * 加载节点，并确认它属于指定的 filespace；不属于时按不存在处理。
     */
    @Transactional(readOnly = true)
    public FsNode getInFileSpace(UUID fileSpaceId, UUID nodeId) {
        FsNode node = loadNode(nodeId);
        if (!fileSpaceId.equals(node.getFileSpaceId())) {
            throw NodeNotFoundException.node(nodeId);
        }
        return node;
    }

    /**
     * 按缓存路径查找存活节点，例如 /Inbox/2024-01-01/report.pdf。
     */
    @Transactional(readOnly = true)
    public FsNode findByPath(UUID fileSpaceId, String path) {
        return nodeRepository
                .findFirstByFileSpaceIdAndPathAndDeletedFalse(fileSpaceId, path)
                .orElseThrow(() -> new NodeNotFoundException("路径未找到: " + path));
    }

    /**
     * 列出目录下（parentId 为 null 时为根层级）的存活子节点，目录在前，文件在后，然后按名称排序。
     */
    @Transactional(readOnly = true)
    public List<FsNode> listChildren(UUID fileSpaceId, UUID parentId) {
        List<FsNode> children = parentId == null
                ? nodeRepository.findByFileSpaceIdAndParentIdIsNullAndDeletedFalse(fileSpaceId)
                : nodeRepository.findByFileSpaceIdAndParentIdAndDeletedFalse(fileSpaceId, parentId);
        return children.stream().sorted(LISTING_ORDER).toList();
    }

    /**
     * 返回目录下所有后代（任意深度），按路径排序。文件节点没有后代。
     */
    @Transactional(readOnly = true)
    public List<FsNode> descendants(UUID nodeId, boolean includeDeleted) {
        FsNode node = loadNode(nodeId);
        if (!node.isDirectory()) {
            return List.of();
        }
        List<FsNode> result = new ArrayList<>();
        for (List<UUID> batch : IdBatches.of(pathCacheService.subtreeIds(node))) {
            result.addAll(nodeRepository.findAllById(batch));
        }
        return result.stream()
                .filter(n -> includeDeleted || !n.isDeleted())
                .sorted(Comparator.comparing(FsNode::getPath))
                .toList();
    }

    // ========================= 创建 =========================

    /**
     * 创建一个新节点。
     *
     * <p>校验顺序：名称合法性 → 父节点属于同一 filespace 且是存活目录 → 唯一性 → 目录丢弃内容字段。</p>
     *
     * @param parentId 父目录ID，null 表示根层级。
     * @param content (可选) 文件内容；对目录会被忽略。
     * @param createdBy (可选) 创建者标识。
     * @return 已保存的节点，其路径已计算好。
     */
    @Transactional
    public FsNode create(
            UUID fileSpaceId, UUID parentId, NodeType type, String name, NodeContent content, String createdBy) {
        NodeNames.validate(name);
        FileSpace fileSpace = lockFileSpace(fileSpaceId);
        FsNode parent = resolveParent(fileSpaceId, parentId);

        var node = new FsNode(fileSpace, parent, type, name, createdBy, clock.instant());
        uniquenessGuard.checkAvailable(fileSpaceId, parentId, name, node.getId());
        node.setPath(pathCacheService.computePath(node));

        if (type.isDirectory()) {
            if (content != null) {
                LOGGER.debug("目录不保存内容，已忽略为 '{}' 提供的内容", node.getPath());
            }
            node.clearContent();
        }
        saveAndFlush(node);
        LOGGER.info("已创建{}: {} (filespace {})", type.isDirectory() ? "目录" : "文件", node.getPath(), fileSpaceId);

        if (!type.isDirectory() && content != null) {
            storeContent(node, content);
        }
        return node;
    }

    /**
     * 返回指定位置同名的存活目录；不存在时创建它。
     */
    @Transactional
    public FsNode getOrCreateDirectory(UUID fileSpaceId, UUID parentId, String name) {
        var existing = parentId == null
                ? nodeRepository.findFirstByFileSpaceIdAndParentIdIsNullAndNameAndNodeTypeAndDeletedFalse(
                        fileSpaceId, name, NodeType.DIRECTORY)
                : nodeRepository.findFirstByFileSpaceIdAndParentIdAndNameAndNodeTypeAndDeletedFalse(
                        fileSpaceId, parentId, name, NodeType.DIRECTORY);
        return existing.orElseGet(() -> create(fileSpaceId, parentId, NodeType.DIRECTORY, name, null, null));
    }

    /**
     * 保证名称在目录内唯一：名称空闲时原样返回，否则追加 " (2)"、" (3)"…… 直到找到空闲的名称。
     */
    @Transactional(readOnly = true)
    public String dedupeName(UUID fileSpaceId, UUID parentId, String baseName) {
        Set<String> taken = listChildren(fileSpaceId, parentId).stream()
                .map(FsNode::getName)
                .collect(Collectors.toCollection(HashSet::new));
        if (!taken.contains(baseName)) {
            return baseName;
        }
        for (int i = 2; ; i++) {
            String candidate = NodeNames.numbered(baseName, i);
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
    }

    // ========================= 修改 =========================

    @Transactional
    public FsNode move(UUID nodeId, UUID newParentId, String newName) {
        return apply(nodeId, NodeChange.moveTo(newParentId, newName)).node();
    }

    @Transactional
    public FsNode rename(UUID nodeId, String newName) {
        return apply(nodeId, NodeChange.rename(newName)).node();
    }

    /**
     * 把节点（以及目录的整个存活子树）移入回收站。
     *
     * @return 受影响的行数。
     */
    @Transactional
    public int trash(UUID nodeId) {
        return apply(nodeId, NodeChange.trash()).affected();
    }

    /**
     * 从回收站恢复节点（以及目录下所有已删除的后代）。
     *
     * @return 受影响的行数。
     */
    @Transactional
    public int restore(UUID nodeId) {
        return apply(nodeId, NodeChange.restore()).affected();
    }

    /**
     * 在一个事务中对节点执行一次组合修改。
     *
     * <p>路径改写一定在删除/恢复级联之前完成：级联通过当前缓存路径查找后代，
     * 如果先级联，使用旧路径的后代会被漏掉。</p>
     */
    @Transactional
    public NodeChangeResult apply(UUID nodeId, NodeChange change) {
        UUID fileSpaceId = lockOwningFileSpace(nodeId);
        FsNode node = loadNode(nodeId);

        int rewritten = 0;
        if (change.isStructural()) {
            String oldPath = node.getPath();
            String newName = change.name() != null ? change.name() : node.getName();
            NodeNames.validate(newName);
            FsNode newParent = change.reparent() ? resolveParent(fileSpaceId, change.parentId()) : node.getParent();
            checkNoCycle(node, newParent);

            UUID newParentId = newParent != null ? newParent.getId() : null;
            boolean liveAfterChange = change.deleted() != null ? !change.deleted() : !node.isDeleted();
            if (liveAfterChange) {
                uniquenessGuard.checkAvailable(fileSpaceId, newParentId, newName, node.getId());
            }

            node.setName(newName);
            node.attachTo(newParent);
            node.setPath(pathCacheService.computePath(node));
            node.setUpdatedAt(clock.instant());
            saveAndFlush(node);
            LOGGER.info("已将 '{}' 移动/重命名为 '{}'", oldPath, node.getPath());

            rewritten = pathCacheService.rewriteDescendants(node, oldPath);
        }

        int affected = 0;
        if (change.deleted() != null) {
            // 批量改写会清空持久化上下文，这里必须重新加载以拿到最新路径
            FsNode current = loadNode(nodeId);
            if (change.deleted()) {
                affected = softDeleteService.trash(current);
            } else {
                if (current.isDeleted()) {
                    uniquenessGuard.checkAvailable(fileSpaceId, current.getParentId(), current.getName(), nodeId);
                }
                affected = softDeleteService.restore(current);
            }
        }
        return new NodeChangeResult(loadNode(nodeId), rewritten, affected);
    }

    // ========================= 内容 =========================

    /**
     * 向文件节点写入内容：计算对象键、大小与 SHA-256 校验和，更新元数据，然后保存字节。
     * blob 存储失败时抛出 StorageException，元数据随事务回滚。
     */
    @Transactional
    public FsNode writeContent(UUID nodeId, NodeContent content) {
        lockOwningFileSpace(nodeId);
        FsNode node = loadNode(nodeId);
        if (!node.isFile()) {
            throw new UnsupportedNodeOperationException("目录不能保存内容: " + node.getPath());
        }
        storeContent(node, content);
        return node;
    }

    /**
     * 当前内容的对象键；还没有内容时返回按节点名称计算出的键。
     */
    @Transactional(readOnly = true)
    public String currentObjectKey(UUID nodeId) {
        return objectKeyService.currentKey(loadNode(nodeId));
    }

    private void storeContent(FsNode node, NodeContent content) {
        String previousKey = node.getContentKey();
        String key = objectKeyService.objectKey(node, content.filename());
        byte[] bytes = content.bytes();

        node.setContentKey(key);
        node.setSizeBytes((long) bytes.length);
        node.setMimeType(StringUtils.hasText(content.mimeType()) ? content.mimeType() : null);
        node.setChecksum(sha256Hex(bytes));
        node.setUpdatedAt(clock.instant());
        saveAndFlush(node);

        try {
            blobStore.put(key, bytes);
        } catch (IOException e) {
            LOGGER.error("写入 blob '{}' 失败，节点 {} 的元数据将回滚", key, node.getId(), e);
            throw new StorageException("保存文件内容失败: " + node.getPath(), e);
        }
        LOGGER.info("已为 '{}' 保存 {} 字节内容，对象键 {}", node.getPath(), bytes.length, key);

        if (previousKey != null && !previousKey.equals(key)) {
            try {
                blobStore.delete(previousKey);
            } catch (IOException e) {
                // 旧 blob 留给后台对账任务回收
                LOGGER.warn("删除旧 blob '{}' 失败: {}", previousKey, e.getMessage());
            }
        }
    }

    // ========================= 内部工具 =========================

    private FsNode loadNode(UUID nodeId) {
        return nodeRepository.findById(nodeId).orElseThrow(() -> NodeNotFoundException.node(nodeId));
    }

    /**
     * 先锁住节点所属的 filespace 再加载节点。
     * 只查询 filespace ID 而不加载实体，保证之后读到的路径是持锁后的最新值。
     *
     * @return 节点所属的 filespace ID。
     */
    private UUID lockOwningFileSpace(UUID nodeId) {
        UUID fileSpaceId = nodeRepository
                .findFileSpaceIdById(nodeId)
                .orElseThrow(() -> NodeNotFoundException.node(nodeId));
        lockFileSpace(fileSpaceId);
        return fileSpaceId;
    }

    /**
     * 对 filespace 行加悲观写锁，串行化同一 filespace 内的结构性修改。
     */
    private FileSpace lockFileSpace(UUID fileSpaceId) {
        try {
            return fileSpaceRepository
                    .findAndLockById(fileSpaceId)
                    .orElseThrow(() -> NodeNotFoundException.fileSpace(fileSpaceId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("filespace 正在被其他操作修改: " + fileSpaceId, e);
        }
    }

    private void saveAndFlush(FsNode node) {
        try {
            nodeRepository.saveAndFlush(node);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("节点已被其他操作修改: " + node.getId(), e);
        }
    }

    /**
     * 解析并校验父节点：必须属于同一 filespace、是目录且未被删除。null 表示根层级。
     */
    private FsNode resolveParent(UUID fileSpaceId, UUID parentId) {
        if (parentId == null) {
            return null;
        }
        FsNode parent = nodeRepository
                .findById(parentId)
                .orElseThrow(() -> new InvalidParentException("父节点不存在: " + parentId));
        if (!fileSpaceId.equals(parent.getFileSpaceId())) {
            throw new InvalidParentException("父节点必须属于同一个 filespace。");
        }
        if (!parent.isDirectory()) {
            throw new InvalidParentException("父节点必须是目录: " + parent.getPath());
        }
        if (parent.isDeleted()) {
            throw new InvalidParentException("父目录已在回收站中: " + parent.getPath());
        }
        return parent;
    }

    /**
     * 沿新父节点的祖先链向上遍历；如果遇到被移动的节点自身，说明移动会产生环。
     */
    private void checkNoCycle(FsNode node, FsNode proposedParent) {
        int depth = 0;
        for (FsNode cur = proposedParent; cur != null; cur = cur.getParent()) {
            if (cur.getId().equals(node.getId())) {
                throw new CycleDetectedException("不能把节点移动到它自身或其后代之下: " + node.getPath());
            }
            if (++depth > maxDepth) {
                throw new CycleDetectedException("祖先链超过最大深度 " + maxDepth + ": " + proposedParent.getId());
            }
        }
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
