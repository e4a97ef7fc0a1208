package com.authority.core.cache;

/**
 * 相关性缓存键：查询时的原始动作（未展开）+ 资源类型
 */
public record RuleKey(String action, String resourceType) {

    @Override
    public String toString() {
        return action + ":" + resourceType;
    }
}
