package xyz.firestige.fleet.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.fleet.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现（进程内同步发布）
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        applicationEventPublisher.publishEvent(event);
    }
}
