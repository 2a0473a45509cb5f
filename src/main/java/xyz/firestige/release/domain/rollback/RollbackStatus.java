package xyz.firestige.release.domain.rollback;

/**
 * 回滚记录状态
 * PENDING → IN_PROGRESS → {SUCCEEDED, FAILED}；FAILED 不会自动重试，需要重新发起
 */
public enum RollbackStatus {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED
}
