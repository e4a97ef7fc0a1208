package com.authority.core.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 规则仓库：只追加、保持插入顺序
 * <p>
 * 下标顺序即新旧顺序即优先级顺序：下标越大越晚加入，评估时越先被考虑。
 * 写时复制，读者总能看到一致的快照。
 * </p>
 */
@Slf4j
public class RuleRepository implements Iterable<Rule> {

    private final List<Rule> rules = new CopyOnWriteArrayList<>();

    public void add(Rule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule must not be null");
        }
        rules.add(rule);
        log.debug("[RuleRepository] Rule #{} added: {}", rules.size() - 1, rule);
    }

    /**
     * 筛选相关规则，保持原插入顺序
     *
     * @param actions      别名展开后的动作集合
     * @param resourceType 资源类型名
     */
    public List<Rule> getRelevantRules(Collection<String> actions, String resourceType) {
        List<Rule> relevant = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.isRelevant(actions, resourceType)) {
                relevant.add(rule);
            }
        }
        return Collections.unmodifiableList(relevant);
    }

    /**
     * @return 全部规则的只读快照，插入顺序
     */
    public List<Rule> all() {
        return List.copyOf(rules);
    }

    public boolean contains(Rule rule) {
        return rules.contains(rule);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public Iterator<Rule> iterator() {
        return all().iterator();
    }
}
