/**
 * DuplicateFileSpaceNameException.java
 *
 * 同一所有者已拥有同名 filespace 时抛出。
 */
package club.ppmc.filespace.exception;

public class DuplicateFileSpaceNameException extends FileSpaceException {

    public DuplicateFileSpaceNameException(String message) {
        super(ErrorCode.DUPLICATE_NAME, message);
    }
}
