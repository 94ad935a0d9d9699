/**
 * NodeType.java
 *
 * 节点类型。声明顺序即列表排序顺序：目录在前，文件在后。
 */
package club.ppmc.filespace.model;

public enum NodeType {
    DIRECTORY,
    FILE;

    public boolean isDirectory() {
        return this == DIRECTORY;
    }
}
