package com.restaurantbi.insightflow.domain.event;

/**
 * EventMatcher - 事件匹配器接口
 * <p>
 * 用于判断一个事件是否符合订阅条件。
 * </p>
 */
public interface EventMatcher {
    /**
     * 判断事件是否匹配
     * @param event 待检查的事件
     * @return true 如果匹配
     */
    boolean matches(Event event);

    static EventMatcher any() {
        return event -> true;
    }

    static EventMatcher ofType(String type) {
        return event -> type.equals(event.getType());
    }
}
