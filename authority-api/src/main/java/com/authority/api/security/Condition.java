package com.authority.api.security;

import java.util.Objects;

/**
 * 规则条件
 * <p>
 * 规则上的条件按 AND 语义组合：全部返回 true 时规则才生效。
 * 条件通过 {@link AuthorityContext} 回读引擎状态（例如当前用户），
 * 不应修改引擎状态。条件抛出的异常会原样传播给 can() 的调用方。
 * </p>
 *
 * @author Authority
 */
@FunctionalInterface
public interface Condition {

    /**
     * 评估条件
     *
     * @param context       引擎上下文
     * @param resourceValue 资源值；仅按类型名查询时为 null
     * @return 条件是否满足
     */
    boolean test(AuthorityContext context, Object resourceValue);

    /**
     * 与另一个条件组合（短路与）
     */
    default Condition and(Condition other) {
        Objects.requireNonNull(other, "other");
        return (context, value) -> test(context, value) && other.test(context, value);
    }

    default Condition negate() {
        return (context, value) -> !test(context, value);
    }

    /**
     * 仅在有资源值时评估的条件，类型查询直接不满足
     */
    static Condition onValue(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        return (context, value) -> value != null && condition.test(context, value);
    }
}
