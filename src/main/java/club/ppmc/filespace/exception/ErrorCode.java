/**
 * ErrorCode.java
 *
 * filespace 层所有失败类型的枚举。
 * Controller 根据它决定返回的 HTTP 状态码。
 */
package club.ppmc.filespace.exception;

public enum ErrorCode {
    INVALID_NAME,
    INVALID_PARENT,
    CYCLE_DETECTED,
    NAME_CONFLICT,
    DUPLICATE_NAME,
    NOT_FOUND,
    UNSUPPORTED_OPERATION,
    STORAGE_ERROR,
    CONCURRENCY_CONFLICT
}
