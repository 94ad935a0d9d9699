/**
 * NodeNotFoundException.java
 *
 * 按ID或路径查找 filespace / 节点失败时抛出。
 */
package club.ppmc.filespace.exception;

import java.util.UUID;

public class NodeNotFoundException extends FileSpaceException {

    public NodeNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NodeNotFoundException node(UUID nodeId) {
        return new NodeNotFoundException("节点不存在: " + nodeId);
    }

    public static NodeNotFoundException fileSpace(UUID fileSpaceId) {
        return new NodeNotFoundException("filespace 不存在: " + fileSpaceId);
    }
}
