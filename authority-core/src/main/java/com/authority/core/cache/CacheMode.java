package com.authority.core.cache;

/**
 * 相关性缓存与规则写入之间的一致性策略
 */
public enum CacheMode {

    /**
     * 每次追加规则或别名都清空整个缓存（默认）
     */
    INVALIDATE_ON_ADD,

    /**
     * 首次相关性查询后拒绝再追加规则或别名
     */
    FREEZE_AFTER_LOOKUP,

    /**
     * 从不失效：已缓存的键看不到之后追加的规则，直到显式 clearCache()。
     * 仅用于复现旧行为。
     */
    STALE
}
