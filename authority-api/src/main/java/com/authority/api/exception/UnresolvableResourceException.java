package com.authority.api.exception;

/**
 * 资源类型无法解析异常
 * <p>
 * 类型解析器无法为某个资源值推导出类型名时抛出。
 * 引擎在 can() 中捕获该异常并按默认拒绝处理，不会向调用方传播。
 * </p>
 */
public class UnresolvableResourceException extends AuthorityException {

    private final Class<?> valueType;

    public UnresolvableResourceException(Class<?> valueType, String message) {
        super(message);
        this.valueType = valueType;
    }

    /**
     * @return 无法解析的值的运行时类型，值为 null 时返回 null
     */
    public Class<?> getValueType() {
        return valueType;
    }
}
