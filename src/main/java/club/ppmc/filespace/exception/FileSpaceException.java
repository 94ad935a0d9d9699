/**
 * FileSpaceException.java
 *
 * filespace 层所有业务异常的基类。
 * 它是一个运行时异常：在 @Transactional 方法中抛出时会让整个事务回滚，
 * 因此任何校验失败或级联中途失败都不会留下半更新的子树。
 * 它携带了结构化的错误信息，以便 Controller 层可以将其转换为对前端友好的响应。
 */
package club.ppmc.filespace.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public abstract class FileSpaceException extends RuntimeException {

    /** 错误类型。 */
    private final ErrorCode code;

    protected FileSpaceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected FileSpaceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", code.name(),
                "message", getMessage() != null ? getMessage() : ""
        );
    }
}
