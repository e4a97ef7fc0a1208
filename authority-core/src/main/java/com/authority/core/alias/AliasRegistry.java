package com.authority.core.alias;

import com.authority.api.security.Alias;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 别名注册表
 * <p>
 * 别名与动作共享同一命名空间。按名字存储，同名后写覆盖并保留原注册位置。
 * 已创建的规则保存的是原始动作字符串，覆盖别名不影响它们。
 * </p>
 */
@Slf4j
public class AliasRegistry {

    // 写时整体替换，读者拿到的始终是不可变快照
    private volatile Map<String, Alias> aliases = Collections.emptyMap();

    public synchronized Alias addAlias(String name, Collection<String> actions) {
        Alias alias = Alias.of(name, actions);
        Map<String, Alias> next = new LinkedHashMap<>(aliases);
        Alias previous = next.put(alias.name(), alias);
        aliases = Collections.unmodifiableMap(next);

        if (previous != null) {
            log.info("[Alias] Redefined alias [{}]: {} -> {}", name, previous.actions(), alias.actions());
        } else {
            log.info("[Alias] Registered alias [{}]: {}", name, alias.actions());
        }
        return alias;
    }

    /**
     * 展开动作：{action} ∪ {直接包含 action 的别名名}
     * <p>
     * 仅一层：只检查每个别名是否直接包含所查询的字面动作，不做传递展开。
     * 结果顺序为动作本身在前，其后按别名注册顺序。
     * </p>
     */
    public Set<String> expandForAction(String action) {
        Set<String> actions = new LinkedHashSet<>();
        actions.add(action);
        for (Alias alias : aliases.values()) {
            if (alias.includes(action)) {
                actions.add(alias.name());
            }
        }
        return Collections.unmodifiableSet(actions);
    }

    public Optional<Alias> get(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    /**
     * @return 全部别名，按注册顺序
     */
    public Map<String, Alias> all() {
        return aliases;
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }
}
