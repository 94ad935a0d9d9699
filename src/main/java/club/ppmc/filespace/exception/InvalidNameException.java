/**
 * InvalidNameException.java
 *
 * 节点名称为空，或包含路径分隔符 '/' 或空字节时抛出。
 */
package club.ppmc.filespace.exception;

public class InvalidNameException extends FileSpaceException {

    public InvalidNameException(String message) {
        super(ErrorCode.INVALID_NAME, message);
    }
}
