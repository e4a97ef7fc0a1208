package com.authority.core.config;

import com.authority.core.cache.CacheMode;
import com.authority.core.resolver.TypeNaming;
import lombok.Builder;
import lombok.Getter;

/**
 * 引擎配置
 */
@Getter
@Builder(toBuilder = true)
public class AuthorityConfig {

    // ==================== 缓存 ====================

    /**
     * 规则写入与相关性缓存的一致性策略
     */
    @Builder.Default
    private CacheMode cacheMode = CacheMode.INVALIDATE_ON_ADD;

    /**
     * 相关性缓存最多保留的 (动作, 资源类型) 键数量，超出后按大小淘汰，淘汰的键会被重新计算
     */
    @Builder.Default
    private long cacheMaximumSize = 10_000;

    // ==================== 资源解析 ====================

    /**
     * 默认解析器由类推导类型名的方式
     */
    @Builder.Default
    private TypeNaming typeNaming = TypeNaming.SIMPLE_NAME;

    /**
     * 未设置（builder 中显式传入 null）时回退为 INVALIDATE_ON_ADD
     */
    public CacheMode getCacheMode() {
        return cacheMode == null ? CacheMode.INVALIDATE_ON_ADD : cacheMode;
    }

    // ==================== 工厂方法 ====================

    public static AuthorityConfig defaults() {
        return AuthorityConfig.builder().build();
    }

    /**
     * 旧行为：缓存从不失效
     */
    public static AuthorityConfig legacy() {
        return AuthorityConfig.builder()
                .cacheMode(CacheMode.STALE)
                .build();
    }

    /**
     * 严格模式：首次查询后规则集只读
     */
    public static AuthorityConfig strict() {
        return AuthorityConfig.builder()
                .cacheMode(CacheMode.FREEZE_AFTER_LOOKUP)
                .build();
    }

    @Override
    public String toString() {
        return String.format("AuthorityConfig{cacheMode=%s, cacheMaximumSize=%d, typeNaming=%s}",
                getCacheMode(), cacheMaximumSize, typeNaming);
    }
}
