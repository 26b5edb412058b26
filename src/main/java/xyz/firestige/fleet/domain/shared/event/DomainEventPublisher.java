package xyz.firestige.fleet.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 领域层依赖该抽象，具体传输机制由基础设施层实现。
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     */
    void publish(Object event);

    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
