package com.guardframe.core.event;

import com.guardframe.api.event.GuardEvent;
import com.guardframe.api.event.GuardEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class EventBus {

    private final Map<Class<? extends GuardEvent>, List<GuardEventListener<? extends GuardEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends GuardEvent> void subscribe(Class<E> eventType, GuardEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(listener);
    }

    public <E extends GuardEvent> void publish(E event) {
        List<GuardEventListener<? extends GuardEvent>> eventListeners = listeners.get(event.getClass());
        if (eventListeners == null) {
            return;
        }
        for (GuardEventListener<? extends GuardEvent> listener : eventListeners) {
            try {
                @SuppressWarnings("unchecked")
                GuardEventListener<E> castListener = (GuardEventListener<E>) listener;
                castListener.onEvent(event);
            } catch (RuntimeException e) {
                // 监听器只做观察，不能改变请求的放行/拒绝结论
                log.error("Event listener failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }
}
