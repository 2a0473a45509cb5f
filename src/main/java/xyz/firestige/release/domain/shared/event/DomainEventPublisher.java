package xyz.firestige.release.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 领域层依赖此抽象，具体传输机制（Spring 本地事件总线等）由基础设施层实现。
 * 事件只在对应的状态变更保存之后发布。
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(DomainEvent event);

    /**
     * 批量发布领域事件（按列表顺序）
     *
     * @param events 领域事件列表
     */
    default void publishAll(List<? extends DomainEvent> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
