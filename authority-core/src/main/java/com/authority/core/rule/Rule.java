package com.authority.core.rule;

import com.authority.api.exception.InvalidArgumentException;
import com.authority.api.resource.ResourceRef;
import com.authority.api.security.AuthorityContext;
import com.authority.api.security.Behavior;
import com.authority.api.security.Condition;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 鉴权规则
 * <p>
 * (行为, 动作, 资源类型, 条件) 四元组。除 {@link #when(Condition)} 追加条件外不可变；
 * 追加条件应在规则被并发读取前完成。相关性缓存持有规则引用，追加的条件对之后的判定立即可见。
 * </p>
 *
 * @author Authority
 */
public class Rule {

    private final Behavior behavior;
    private final String action;
    private final String resourceType;
    private final List<Condition> conditions = new CopyOnWriteArrayList<>();

    public Rule(Behavior behavior, String action, String resourceType) {
        this(behavior, action, resourceType, null);
    }

    public Rule(Behavior behavior, String action, String resourceType, Condition condition) {
        if (behavior == null) {
            throw new InvalidArgumentException("behavior", "Rule behavior must not be null");
        }
        this.behavior = behavior;
        this.action = InvalidArgumentException.requireText("action", action);
        this.resourceType = InvalidArgumentException.requireText("resourceType", resourceType);
        addCondition(condition);
    }

    // ==================== 评估 ====================

    /**
     * 判断规则是否生效：所有条件均通过；无条件时恒为 true
     */
    public boolean applies(AuthorityContext context, Object resourceValue) {
        for (Condition condition : conditions) {
            if (!condition.test(context, resourceValue)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 规则是特权且生效
     */
    public boolean isAllowed(AuthorityContext context, Object resourceValue) {
        return isPrivilege() && applies(context, resourceValue);
    }

    /**
     * 规则是限制且生效
     */
    public boolean isDisallowed(AuthorityContext context, Object resourceValue) {
        return isRestriction() && applies(context, resourceValue);
    }

    // ==================== 相关性匹配 ====================

    public boolean isRelevant(String action, String resourceType) {
        return matchesAction(action) && matchesResource(resourceType);
    }

    public boolean isRelevant(Collection<String> actions, String resourceType) {
        return matchesAction(actions) && matchesResource(resourceType);
    }

    public boolean matchesAction(String action) {
        return this.action.equals(action);
    }

    /**
     * 别名展开后按集合成员判断
     */
    public boolean matchesAction(Collection<String> actions) {
        return actions != null && actions.contains(this.action);
    }

    public boolean matchesResource(String resourceType) {
        return ResourceRef.ALL.equals(this.resourceType) || this.resourceType.equals(resourceType);
    }

    // ==================== 条件 ====================

    /**
     * 追加条件，addCondition 的链式写法
     */
    public Rule when(Condition condition) {
        addCondition(condition);
        return this;
    }

    public void addCondition(Condition condition) {
        if (condition != null) {
            conditions.add(condition);
        }
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public boolean isConditional() {
        return !conditions.isEmpty();
    }

    // ==================== 属性 ====================

    public boolean isPrivilege() {
        return behavior.grants();
    }

    public boolean isRestriction() {
        return !behavior.grants();
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public String getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    @Override
    public String toString() {
        return String.format("Rule{%s %s on %s, conditions=%d}",
                behavior, action, resourceType, conditions.size());
    }
}
