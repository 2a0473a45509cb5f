package xyz.firestige.release.domain.shared.exception;

/**
 * 非法状态迁移异常
 */
public class InvalidTransitionException extends OrchestrationException {

    private final String entity;
    private final String fromStatus;
    private final String toStatus;

    public InvalidTransitionException(String entity, String entityId, Enum<?> from, Enum<?> to) {
        this(entity, entityId, from, to,
                String.format("%s %s 不允许从 %s 迁移到 %s", entity, entityId, from, to));
    }

    public InvalidTransitionException(String entity, String entityId, Enum<?> from, Enum<?> to, String message) {
        super(ErrorType.INVALID_TRANSITION, message);
        this.entity = entity;
        this.fromStatus = from != null ? from.name() : null;
        this.toStatus = to != null ? to.name() : null;
        addContext("entity", entity);
        addContext("entityId", entityId);
        addContext("actualStatus", fromStatus);
        addContext("requestedStatus", toStatus);
    }

    public String getEntity() {
        return entity;
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
