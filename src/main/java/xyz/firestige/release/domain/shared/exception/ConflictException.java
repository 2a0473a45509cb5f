package xyz.firestige.release.domain.shared.exception;

/**
 * 冲突异常
 * 唯一性或状态前置条件不满足（重复的活跃部署、审批已决策等）
 */
public class ConflictException extends OrchestrationException {

    public ConflictException(String message) {
        super(ErrorType.CONFLICT, message);
    }
}
