/**
 * NodeChange.java
 *
 * 对单个节点的一次结构性修改：可以同时改变父目录、名称和删除状态。
 * move、rename、trash、restore 都是它的特例。
 *
 * @param reparent 是否修改父目录；为 false 时忽略 parentId。
 * @param parentId 新的父目录ID，null 表示移动到根层级。
 * @param name 新名称，null 表示保持不变。
 * @param deleted 目标删除状态，null 表示保持不变。
 */
package club.ppmc.filespace.model;

import java.util.UUID;

public record NodeChange(boolean reparent, UUID parentId, String name, Boolean deleted) {

    public static NodeChange rename(String name) {
        return new NodeChange(false, null, name, null);
    }

    public static NodeChange moveTo(UUID parentId, String name) {
        return new NodeChange(true, parentId, name, null);
    }

    public static NodeChange trash() {
        return new NodeChange(false, null, null, Boolean.TRUE);
    }

    public static NodeChange restore() {
        return new NodeChange(false, null, null, Boolean.FALSE);
    }

    public NodeChange withDeleted(boolean newDeleted) {
        return new NodeChange(reparent, parentId, name, newDeleted);
    }

    public boolean isStructural() {
        return reparent || name != null;
    }
}
