package com.authority.api.security;

import com.authority.api.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 动作别名：一个名字代表一组动作
 * <p>
 * 只做一层包含判断，别名不会递归展开其内部的其他别名。
 * </p>
 *
 * @param name    别名，例如 "manage"
 * @param actions 别名包含的动作，保持注册顺序
 */
public record Alias(String name, Set<String> actions) {

    public Alias {
        InvalidArgumentException.requireText("name", name);
        if (actions == null) {
            throw new InvalidArgumentException("actions", "Alias [" + name + "] requires an action list");
        }
        actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
    }

    public static Alias of(String name, Collection<String> actions) {
        return new Alias(name, actions == null ? null : new LinkedHashSet<>(actions));
    }

    public static Alias of(String name, String... actions) {
        return of(name, actions == null ? null : Arrays.asList(actions));
    }

    /**
     * 判断别名是否直接包含某个动作
     */
    public boolean includes(String action) {
        return actions.contains(action);
    }

    @Override
    public String toString() {
        return name + "=" + actions;
    }

}
