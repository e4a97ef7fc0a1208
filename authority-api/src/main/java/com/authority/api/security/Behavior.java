package com.authority.api.security;

/**
 * 规则行为枚举
 * 决定规则生效时的判定结果。
 *
 * @author Authority
 */
public enum Behavior {
    /**
     * 特权 - 规则生效时允许访问
     */
    PRIVILEGE(true),

    /**
     * 限制 - 规则生效时拒绝访问
     */
    RESTRICTION(false);

    private final boolean grants;

    Behavior(boolean grants) {
        this.grants = grants;
    }

    /**
     * @return 规则生效时是否放行
     */
    public boolean grants() {
        return grants;
    }

    /**
     * 由布尔值构建行为：true 为特权，false 为限制
     */
    public static Behavior of(boolean allow) {
        return allow ? PRIVILEGE : RESTRICTION;
    }
}
