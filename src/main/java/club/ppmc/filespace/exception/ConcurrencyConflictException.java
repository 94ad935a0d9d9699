/**
 * ConcurrencyConflictException.java
 *
 * 无法获取 filespace 行锁，或乐观锁版本校验失败时抛出。
 * 本层不重试，重试策略由调用方决定。
 */
package club.ppmc.filespace.exception;

public class ConcurrencyConflictException extends FileSpaceException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message, cause);
    }
}
