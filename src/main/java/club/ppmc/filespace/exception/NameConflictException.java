/**
 * NameConflictException.java
 *
 * 同一目录下（或 filespace 根层级）已存在同名的存活节点时抛出。
 */
package club.ppmc.filespace.exception;

public class NameConflictException extends FileSpaceException {

    public NameConflictException(String message) {
        super(ErrorCode.NAME_CONFLICT, message);
    }
}
