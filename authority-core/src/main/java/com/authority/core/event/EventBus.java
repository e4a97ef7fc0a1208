package com.authority.core.event;

import com.authority.api.event.AuthorityEventListener;
import com.authority.api.spi.EventSink;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内事件总线，按事件名分发
 * <p>
 * 可直接作为引擎的 {@link EventSink}，fire 返回所有监听器的非 null 响应。
 * </p>
 */
@Slf4j
public class EventBus implements EventSink {

    private final Map<String, List<ListenerWrapper>> listeners = new ConcurrentHashMap<>();

    // 包装器，记录监听器归属方
    @Value
    static class ListenerWrapper {
        String ownerId;
        AuthorityEventListener listener;
    }

    /**
     * 注册监听器
     */
    public void subscribe(String ownerId, String eventName, AuthorityEventListener listener) {
        listeners.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>())
                .add(new ListenerWrapper(ownerId, listener));
        log.debug("Subscribed listener of [{}] to event [{}]", ownerId, eventName);
    }

    /**
     * 移除某个归属方注册的所有监听器
     */
    public void unsubscribeAll(String ownerId) {
        log.info("Cleaning up event listeners for owner: {}", ownerId);
        for (List<ListenerWrapper> list : listeners.values()) {
            list.removeIf(wrapper -> {
                boolean match = wrapper.getOwnerId().equals(ownerId);
                if (match) {
                    log.debug("Removed listener: {}", wrapper.getListener().getClass().getName());
                }
                return match;
            });
        }
    }

    public int listenerCount(String eventName) {
        List<ListenerWrapper> wrappers = listeners.get(eventName);
        return wrappers == null ? 0 : wrappers.size();
    }

    @Override
    public Object fire(String eventName, Map<String, Object> payload) {
        List<ListenerWrapper> wrappers = listeners.get(eventName);
        if (wrappers == null || wrappers.isEmpty()) {
            return Collections.emptyList();
        }
        List<Object> responses = new ArrayList<>();
        for (ListenerWrapper wrapper : wrappers) {
            try {
                Object response = wrapper.getListener().onEvent(eventName, payload);
                if (response != null) {
                    responses.add(response);
                }
            } catch (RuntimeException e) {
                log.warn("Event listener of [{}] threw exception on [{}], propagating: {}",
                        wrapper.getOwnerId(), eventName, e.getMessage());
                throw e; // Fail-Fast
            }
        }
        return responses;
    }
}
