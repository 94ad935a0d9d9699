/**
 * StorageException.java
 *
 * 外部 blob 存储调用失败时抛出。
 * 元数据事务会随之回滚；孤立 blob 的回收不在本层处理。
 */
package club.ppmc.filespace.exception;

public class StorageException extends FileSpaceException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
