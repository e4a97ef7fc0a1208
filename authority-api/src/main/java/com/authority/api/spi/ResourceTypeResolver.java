package com.authority.api.spi;

import com.authority.api.exception.UnresolvableResourceException;

/**
 * 宿主提供 - 资源值到类型名的解析器
 *
 * @author Authority
 */
public interface ResourceTypeResolver {

    /**
     * 为资源值推导类型名
     *
     * @param value 资源值
     * @return 类型名，不为空
     * @throws UnresolvableResourceException 无法推导时
     */
    String resolve(Object value);

    /**
     * 为类推导类型名，用于以 Class 声明规则的场景
     *
     * @throws UnresolvableResourceException 无法推导时
     */
    String nameOf(Class<?> type);
}
