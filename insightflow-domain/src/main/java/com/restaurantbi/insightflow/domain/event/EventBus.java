package com.restaurantbi.insightflow.domain.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * EventBus - 进程内同步事件总线
 * <p>
 * 在发布线程上依次分发给匹配的订阅者，因此同一运行的事件顺序与发布顺序一致。
 * 单个订阅者抛出的异常只记录日志，不影响其他订阅者和发布方。
 * </p>
 */
@Slf4j
public class EventBus implements EventPublisher {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public void subscribe(EventMatcher matcher, EventListener listener) {
        subscriptions.add(new Subscription(matcher, listener));
    }

    public void subscribe(EventListener listener) {
        subscribe(EventMatcher.any(), listener);
    }

    @Override
    public void publish(Event event) {
        log.debug("Publishing event {} #{} for run [{}]", event.getType(), event.getSequence(), event.getRunId());
        for (Subscription subscription : subscriptions) {
            if (!subscription.matcher.matches(event)) {
                continue;
            }
            try {
                subscription.listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener failed on event {} for run [{}]", event.getType(), event.getRunId(), e);
            }
        }
    }

    private static final class Subscription {
        private final EventMatcher matcher;
        private final EventListener listener;

        private Subscription(EventMatcher matcher, EventListener listener) {
            this.matcher = matcher;
            this.listener = listener;
        }
    }
}
