package com.authority.core;

import com.authority.api.event.AuthorityEvents;
import com.authority.api.exception.AliasNotFoundException;
import com.authority.api.exception.InvalidArgumentException;
import com.authority.api.exception.RuleRepositoryFrozenException;
import com.authority.api.exception.UnresolvableResourceException;
import com.authority.api.resource.ResolvedResource;
import com.authority.api.resource.ResourceRef;
import com.authority.api.security.Alias;
import com.authority.api.security.AuthorityContext;
import com.authority.api.security.Behavior;
import com.authority.api.security.Condition;
import com.authority.api.spi.EventSink;
import com.authority.api.spi.ResourceTypeResolver;
import com.authority.core.alias.AliasRegistry;
import com.authority.core.cache.CacheMode;
import com.authority.core.cache.RelevanceCache;
import com.authority.core.cache.RuleKey;
import com.authority.core.config.AuthorityConfig;
import com.authority.core.resolver.DefaultResourceTypeResolver;
import com.authority.core.rule.Rule;
import com.authority.core.rule.RuleRepository;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 鉴权引擎
 * <p>
 * 回答“当前用户能否对资源执行某动作”：
 * 别名展开 → 相关规则（经缓存）→ 从最近加入的规则往前扫描 →
 * 第一条生效规则的行为即为结果 → 无规则生效时默认拒绝。
 * </p>
 * <p>
 * 先声明宽泛的默认规则，再逐步追加更具体的例外，例外因为加入得晚而自然胜出。
 * </p>
 * <p>
 * 单写者模型：allow/deny/addAlias/when 需要调用方在共享实例时自行互斥；
 * 没有并发写入时 can() 可被多线程同时调用。
 * </p>
 *
 * @author Authority
 */
@Slf4j
public class Authority implements AuthorityContext {

    private final RuleRepository rules = new RuleRepository();
    private final AliasRegistry aliases = new AliasRegistry();
    private final RelevanceCache relevanceCache;
    private final AuthorityConfig config;
    private final ResourceTypeResolver resolver;

    private volatile Object currentUser;
    private volatile EventSink eventSink;

    // FREEZE_AFTER_LOOKUP 模式下的冻结标记
    private volatile boolean lookedUp = false;

    public Authority(Object currentUser) {
        this(currentUser, null, null, null);
    }

    public Authority(Object currentUser, EventSink eventSink) {
        this(currentUser, eventSink, null, null);
    }

    @Builder
    private Authority(Object currentUser, EventSink eventSink, AuthorityConfig config,
                      ResourceTypeResolver resolver) {
        this.config = config == null ? AuthorityConfig.defaults() : config;
        this.resolver = resolver == null
                ? new DefaultResourceTypeResolver(this.config.getTypeNaming())
                : resolver;
        this.relevanceCache = new RelevanceCache(this.config.getCacheMaximumSize());
        this.eventSink = eventSink;
        this.currentUser = currentUser;

        log.info("[Authority] Initialized: {}, resolver={}", this.config, this.resolver.getClass().getSimpleName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(AuthorityEvents.PAYLOAD_USER, getCurrentUser());
        dispatch(AuthorityEvents.INITIALIZED, payload);
    }

    // ==================== 判定 ====================

    @Override
    public boolean can(String action, String resourceType) {
        return can(action, ResourceRef.type(resourceType), null);
    }

    @Override
    public boolean can(String action, String resourceType, Object resourceValue) {
        return can(action, ResourceRef.type(resourceType), resourceValue);
    }

    /**
     * 以资源值查询，类型名由解析器推导
     */
    public boolean can(String action, Object resourceValue) {
        return can(action, ResourceRef.value(resourceValue), null);
    }

    public boolean can(String action, Class<?> resourceType) {
        return can(action, resourceType, null);
    }

    public boolean can(String action, Class<?> resourceType, Object resourceValue) {
        String typeName;
        try {
            typeName = requireTypeName(resolver.nameOf(resourceType), resourceType);
        } catch (UnresolvableResourceException e) {
            log.warn("[Authority] Unresolvable resource class for action [{}]: {} -> deny", action, e.getMessage());
            return false;
        }
        return can(action, ResourceRef.type(typeName), resourceValue);
    }

    public boolean can(String action, ResourceRef resource) {
        return can(action, resource, null);
    }

    /**
     * 判定入口
     *
     * @param action        动作名（可为别名）
     * @param resource      资源引用；值引用时 resourceValue 被忽略，以引用的值为准
     * @param resourceValue 类型引用时附带的资源值，可为 null
     * @return 是否允许
     */
    public boolean can(String action, ResourceRef resource, Object resourceValue) {
        InvalidArgumentException.requireText("action", action);

        ResolvedResource target;
        try {
            target = normalize(resource, resourceValue);
        } catch (UnresolvableResourceException e) {
            log.warn("[Authority] Unresolvable resource for action [{}]: {} -> deny", action, e.getMessage());
            return false;
        }

        List<Rule> relevant = getRulesFor(action, target.typeName());

        // 从后往前：最近加入的相关规则优先
        for (int i = relevant.size() - 1; i >= 0; i--) {
            Rule rule = relevant.get(i);
            if (rule.applies(this, target.value())) {
                boolean allowed = rule.isPrivilege();
                log.debug("[Authority] {} {} on {} decided by {} -> {}",
                        action, target.hasValue() ? "value" : "type", target.typeName(), rule, allowed);
                return allowed;
            }
        }

        log.debug("[Authority] No rule applies to {} on {} ({} relevant) -> default deny",
                action, target.typeName(), relevant.size());
        return false;
    }

    public boolean cannot(String action, String resourceType) {
        return !can(action, resourceType);
    }

    public boolean cannot(String action, String resourceType, Object resourceValue) {
        return !can(action, resourceType, resourceValue);
    }

    public boolean cannot(String action, Object resourceValue) {
        return !can(action, resourceValue);
    }

    public boolean cannot(String action, Class<?> resourceType) {
        return !can(action, resourceType);
    }

    public boolean cannot(String action, Class<?> resourceType, Object resourceValue) {
        return !can(action, resourceType, resourceValue);
    }

    public boolean cannot(String action, ResourceRef resource) {
        return !can(action, resource);
    }

    public boolean cannot(String action, ResourceRef resource, Object resourceValue) {
        return !can(action, resource, resourceValue);
    }

    private ResolvedResource normalize(ResourceRef resource, Object resourceValue) {
        if (resource instanceof ResourceRef.TypeName) {
            return new ResolvedResource(((ResourceRef.TypeName) resource).name(), resourceValue);
        }
        if (resource instanceof ResourceRef.Value) {
            Object value = ((ResourceRef.Value) resource).value();
            return new ResolvedResource(
                    requireTypeName(resolver.resolve(value), value == null ? null : value.getClass()), value);
        }
        throw new InvalidArgumentException("resource", resource, "Unsupported resource reference: " + resource);
    }

    /**
     * 解析器返回 null 或空白类型名同样视为无法解析
     */
    private static String requireTypeName(String typeName, Class<?> valueType) {
        if (typeName == null || typeName.isBlank()) {
            throw new UnresolvableResourceException(valueType,
                    "Resolver returned no type name for " + (valueType == null ? "null" : valueType.getName()));
        }
        return typeName;
    }

    // ==================== 规则定义 ====================

    public Rule allow(String action, String resourceType) {
        return addRule(Behavior.PRIVILEGE, action, resourceType, null);
    }

    public Rule allow(String action, String resourceType, Condition condition) {
        return addRule(Behavior.PRIVILEGE, action, resourceType, condition);
    }

    public Rule allow(String action, Class<?> resourceType) {
        return addRule(Behavior.PRIVILEGE, action, resolver.nameOf(resourceType), null);
    }

    public Rule allow(String action, Class<?> resourceType, Condition condition) {
        return addRule(Behavior.PRIVILEGE, action, resolver.nameOf(resourceType), condition);
    }

    public Rule deny(String action, String resourceType) {
        return addRule(Behavior.RESTRICTION, action, resourceType, null);
    }

    public Rule deny(String action, String resourceType, Condition condition) {
        return addRule(Behavior.RESTRICTION, action, resourceType, condition);
    }

    public Rule deny(String action, Class<?> resourceType) {
        return addRule(Behavior.RESTRICTION, action, resolver.nameOf(resourceType), null);
    }

    public Rule deny(String action, Class<?> resourceType, Condition condition) {
        return addRule(Behavior.RESTRICTION, action, resolver.nameOf(resourceType), condition);
    }

    public Rule addRule(boolean allow, String action, String resourceType, Condition condition) {
        return addRule(Behavior.of(allow), action, resourceType, condition);
    }

    /**
     * 追加规则
     *
     * @throws RuleRepositoryFrozenException FREEZE_AFTER_LOOKUP 模式下首次查询之后调用
     */
    public Rule addRule(Behavior behavior, String action, String resourceType, Condition condition) {
        Rule rule = new Rule(behavior, action, resourceType, condition);
        beforeMutation("addRule " + rule);
        rules.add(rule);
        afterMutation();
        return rule;
    }

    // ==================== 别名 ====================

    public Alias addAlias(String name, Collection<String> actions) {
        beforeMutation("addAlias " + name);
        Alias alias = aliases.addAlias(name, actions);
        afterMutation();
        return alias;
    }

    public Alias addAlias(String name, String... actions) {
        return addAlias(name, actions == null ? null : Arrays.asList(actions));
    }

    public Map<String, Alias> getAliases() {
        return aliases.all();
    }

    public Optional<Alias> getAlias(String name) {
        return aliases.get(name);
    }

    /**
     * @throws AliasNotFoundException 别名未注册时
     */
    public Alias requireAlias(String name) {
        return aliases.get(name).orElseThrow(() -> new AliasNotFoundException(name));
    }

    @Override
    public Set<String> getAliasesForAction(String action) {
        return aliases.expandForAction(action);
    }

    // ==================== 规则查询 ====================

    public RuleRepository getRules() {
        return rules;
    }

    /**
     * 返回与 (动作, 资源类型) 相关的规则，保持插入顺序；结果按键缓存
     */
    public List<Rule> getRulesFor(String action, String resourceType) {
        lookedUp = true;
        return relevanceCache.get(new RuleKey(action, resourceType),
                key -> rules.getRelevantRules(aliases.expandForAction(key.action()), key.resourceType()));
    }

    /**
     * 清空相关性缓存；FREEZE_AFTER_LOOKUP 模式下不会解除冻结
     */
    public void clearCache() {
        relevanceCache.invalidateAll();
        log.debug("[Authority] Relevance cache cleared");
    }

    private void beforeMutation(String operation) {
        if (config.getCacheMode() == CacheMode.FREEZE_AFTER_LOOKUP && lookedUp) {
            log.warn("[Authority] Rejected {} after first lookup (cacheMode={})", operation, config.getCacheMode());
            throw new RuleRepositoryFrozenException(operation);
        }
    }

    private void afterMutation() {
        if (config.getCacheMode() == CacheMode.INVALIDATE_ON_ADD) {
            relevanceCache.invalidateAll();
        }
    }

    RelevanceCache relevanceCache() {
        return relevanceCache;
    }

    // ==================== 用户与事件 ====================

    @Override
    public Object getCurrentUser() {
        return currentUser;
    }

    public void setCurrentUser(Object currentUser) {
        this.currentUser = currentUser;
    }

    public EventSink getEventSink() {
        return eventSink;
    }

    public void setEventSink(EventSink eventSink) {
        this.eventSink = eventSink;
    }

    /**
     * 向事件接收器触发事件
     *
     * @return 接收器的结果；未配置接收器时为 null
     */
    public Object dispatch(String eventName, Map<String, Object> payload) {
        EventSink sink = this.eventSink;
        if (sink == null) {
            return null;
        }
        log.debug("[Authority] Dispatching event [{}]", eventName);
        return sink.fire(eventName, payload == null ? Map.of() : payload);
    }

    public AuthorityConfig getConfig() {
        return config;
    }

    public ResourceTypeResolver getResolver() {
        return resolver;
    }
}
