package com.authority.api.spi;

import java.util.Map;

/**
 * 宿主提供 - 事件接收器
 * <p>
 * 引擎只在生命周期节点调用它（发完即忘），返回值原样交还给
 * {@code Authority.dispatch} 的调用方。
 * </p>
 */
@FunctionalInterface
public interface EventSink {

    /**
     * 触发事件
     *
     * @param eventName 事件名，例如 "authority.initialized"
     * @param payload   事件负载，可能包含 null 值
     * @return 接收器的可选结果
     */
    Object fire(String eventName, Map<String, Object> payload);
}
