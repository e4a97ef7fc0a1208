package com.authority.core.cache;

import com.authority.core.rule.Rule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * 相关性缓存
 * <p>
 * 按 (动作, 资源类型) 记忆筛选出的相关规则列表（保持插入顺序，引用规则而非拷贝）。
 * 同一键的填充是原子的：并发未命中时只计算一次。
 * </p>
 */
@Slf4j
public class RelevanceCache {

    private final Cache<RuleKey, List<Rule>> cache;

    public RelevanceCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * 命中直接返回，未命中则用 loader 计算并缓存
     */
    public List<Rule> get(RuleKey key, Function<RuleKey, List<Rule>> loader) {
        return cache.get(key, k -> {
            List<Rule> rules = loader.apply(k);
            log.debug("[RelevanceCache] Filled {} -> {} relevant rule(s)", k, rules.size());
            return rules;
        });
    }

    public List<Rule> getIfPresent(RuleKey key) {
        return cache.getIfPresent(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }
}
