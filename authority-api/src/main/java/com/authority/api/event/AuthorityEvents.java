package com.authority.api.event;

/**
 * 引擎生命周期事件名及负载键
 */
public final class AuthorityEvents {

    /**
     * 引擎构造完成，负载：{user: 当前用户}
     */
    public static final String INITIALIZED = "authority.initialized";

    public static final String PAYLOAD_USER = "user";

    private AuthorityEvents() {
    }
}
