package xyz.firestige.release.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.release.domain.shared.event.DomainEvent;
import xyz.firestige.release.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现（单机部署）
 * <p>
 * 同步/异步取决于监听方的 @EventListener / @Async 配置
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(DomainEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
