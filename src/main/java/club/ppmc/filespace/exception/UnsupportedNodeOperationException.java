/**
 * UnsupportedNodeOperationException.java
 *
 * 对节点类型不支持的操作，例如向目录写入内容。
 */
package club.ppmc.filespace.exception;

public class UnsupportedNodeOperationException extends FileSpaceException {

    public UnsupportedNodeOperationException(String message) {
        super(ErrorCode.UNSUPPORTED_OPERATION, message);
    }
}
