package com.authority.api.event;

import java.util.Map;

/**
 * 事件监听器
 */
@FunctionalInterface
public interface AuthorityEventListener {

    /**
     * @return 监听器的响应，可为 null（不计入结果）
     */
    Object onEvent(String eventName, Map<String, Object> payload);
}
