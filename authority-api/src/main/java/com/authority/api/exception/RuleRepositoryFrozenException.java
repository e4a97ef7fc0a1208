package com.authority.api.exception;

/**
 * 规则库已冻结异常
 * <p>
 * 在 FREEZE_AFTER_LOOKUP 缓存模式下，首次相关性查询之后再追加规则或别名时抛出。
 * </p>
 */
public class RuleRepositoryFrozenException extends AuthorityException {

    private final String operation;

    public RuleRepositoryFrozenException(String operation) {
        super("Rule set is frozen after the first lookup, refusing: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
