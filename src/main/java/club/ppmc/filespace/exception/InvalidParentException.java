/**
 * InvalidParentException.java
 *
 * 父节点不属于同一个 filespace、不是目录，或已被软删除时抛出。
 */
package club.ppmc.filespace.exception;

public class InvalidParentException extends FileSpaceException {

    public InvalidParentException(String message) {
        super(ErrorCode.INVALID_PARENT, message);
    }
}
