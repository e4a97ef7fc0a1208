package com.authority.api.security;

import java.util.Set;

/**
 * 引擎上下文：条件评估时可见的只读视图
 *
 * @author Authority
 */
public interface AuthorityContext {

    /**
     * 当前主体
     */
    Object getCurrentUser();

    /**
     * getCurrentUser() 的简写
     */
    default Object user() {
        return getCurrentUser();
    }

    /**
     * 以指定类型获取当前主体
     *
     * @throws ClassCastException 当前主体不是该类型时
     */
    default <U> U getCurrentUser(Class<U> type) {
        return type.cast(getCurrentUser());
    }

    boolean can(String action, String resourceType);

    boolean can(String action, String resourceType, Object resourceValue);

    /**
     * 返回某个动作展开后的全部动作名（自身 + 直接包含它的别名）
     */
    Set<String> getAliasesForAction(String action);
}
