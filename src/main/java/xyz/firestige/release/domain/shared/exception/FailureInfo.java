package xyz.firestige.release.domain.shared.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * 记录部署失败、回滚失败的原因，随实体一起保存
 */
public class FailureInfo {

    private final ErrorType errorType;

    private final String errorMessage;

    /**
     * 失败位置（Stage 名称或操作名）
     */
    private final String failedAt;

    private final LocalDateTime timestamp;

    private FailureInfo(ErrorType errorType, String errorMessage, String failedAt, LocalDateTime timestamp) {
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.failedAt = failedAt;
        this.timestamp = timestamp;
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt, LocalDateTime timestamp) {
        return new FailureInfo(errorType, errorMessage, failedAt, timestamp);
    }

    public static FailureInfo fromException(Exception e, String failedAt, LocalDateTime timestamp) {
        ErrorType type = e instanceof OrchestrationException
                ? ((OrchestrationException) e).getErrorType()
                : ErrorType.SYSTEM_ERROR;
        return new FailureInfo(type, e.getMessage(), failedAt, timestamp);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorType.name();
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorType=" + errorType +
                ", errorMessage='" + errorMessage + '\'' +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
