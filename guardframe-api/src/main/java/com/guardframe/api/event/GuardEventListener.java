package com.guardframe.api.event;

/**
 * 事件监听器
 *
 * @author GuardFrame
 */
@FunctionalInterface
public interface GuardEventListener<E extends GuardEvent> {

    void onEvent(E event);
}
