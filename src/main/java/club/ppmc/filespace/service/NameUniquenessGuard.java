/**
 * NameUniquenessGuard.java
 *
 * 名称唯一性约束，只针对存活节点（软删除的节点不会占用名称）：
 * <ul>
 *   <li>同一 (filespace, 父目录) 下名称唯一；</li>
 *   <li>同一 filespace 的根层级名称唯一，这一条单独检查，因为 parent 为 null 时第一条无法覆盖。</li>
 * </ul>
 * 名称比较区分大小写。
 */
package club.ppmc.filespace.service;

import club.ppmc.filespace.exception.NameConflictException;
import club.ppmc.filespace.repository.FsNodeRepository;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class NameUniquenessGuard {

    private final FsNodeRepository nodeRepository;

    public NameUniquenessGuard(FsNodeRepository nodeRepository) {
        this.nodeRepository = nodeRepository;
    }

    /**
     * 检查名称在目标位置是否可用。
     *
     * @param fileSpaceId 所属 filespace。
     * @param parentId 目标父目录，null 表示根层级。
     * @param name 候选名称。
     * @param selfId 正在创建或移动的节点自身，检查时排除。
     * @throws NameConflictException 名称已被其他存活节点占用时抛出。
     */
    public void checkAvailable(UUID fileSpaceId, UUID parentId, String name, UUID selfId) {
        if (parentId == null) {
            if (isTakenAtRoot(fileSpaceId, name, selfId)) {
                throw new NameConflictException("根目录下已存在同名节点: " + name);
            }
        } else if (isTakenInDirectory(fileSpaceId, parentId, name, selfId)) {
            throw new NameConflictException("目录中已存在同名节点: " + name);
        }
    }

    public boolean isTakenInDirectory(UUID fileSpaceId, UUID parentId, String name, UUID selfId) {
        return nodeRepository.existsByFileSpaceIdAndParentIdAndNameAndDeletedFalseAndIdNot(
                fileSpaceId, parentId, name, selfId);
    }

    public boolean isTakenAtRoot(UUID fileSpaceId, String name, UUID selfId) {
        return nodeRepository.existsByFileSpaceIdAndParentIdIsNullAndNameAndDeletedFalseAndIdNot(
                fileSpaceId, name, selfId);
    }
}
