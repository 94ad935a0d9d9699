/**
 * ErrorResponses.java
 *
 * 把 FileSpaceException 转换为统一格式的HTTP错误响应。
 */
package club.ppmc.filespace.controller;

import club.ppmc.filespace.exception.FileSpaceException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> of(FileSpaceException e) {
        return ResponseEntity.status(statusOf(e)).body(e.toErrorData());
    }

    static HttpStatus statusOf(FileSpaceException e) {
        return switch (e.getCode()) {
            case INVALID_NAME, INVALID_PARENT, CYCLE_DETECTED, UNSUPPORTED_OPERATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NAME_CONFLICT, DUPLICATE_NAME, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case STORAGE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
