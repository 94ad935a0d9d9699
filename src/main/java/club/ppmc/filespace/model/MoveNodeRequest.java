/**
 * MoveNodeRequest.java
 *
 * 移动和/或重命名节点的请求体。
 *
 * @param toRoot 为 true 时移动到根层级，此时忽略 parentId。
 * @param parentId 新的父目录ID；与 toRoot 均为空时保持原父目录。
 * @param newName (可选) 新名称 (注意：不是完整路径)。
 * @param trash 为 true 时在同一事务中把节点移入回收站。
 */
package club.ppmc.filespace.model;

import java.util.UUID;

public record MoveNodeRequest(boolean toRoot, UUID parentId, String newName, boolean trash) {

    public NodeChange toChange() {
        boolean reparent = toRoot || parentId != null;
        return new NodeChange(reparent, toRoot ? null : parentId, newName, trash ? Boolean.TRUE : null);
    }
}
