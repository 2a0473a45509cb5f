package xyz.firestige.release.domain.shared.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编排引擎基础异常类
 * <p>
 * 携带错误类型与结构化上下文（部署 ID、阶段名、期望/实际状态），
 * 调用方无需再次查询即可渲染精确的错误信息。
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorType errorType;

    private final Map<String, Object> context = new LinkedHashMap<>();

    public OrchestrationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public OrchestrationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public OrchestrationException addContext(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorType.name();
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "errorType=" + errorType +
                ", message='" + getMessage() + '\'' +
                ", context=" + context +
                '}';
    }
}
