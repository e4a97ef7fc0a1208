package com.authority.api.resource;

/**
 * 归一化后的资源：类型名 + 可选资源值
 *
 * @param typeName 资源类型名
 * @param value    资源值，仅按类型查询时为 null
 */
public record ResolvedResource(String typeName, Object value) {

    public boolean hasValue() {
        return value != null;
    }
}
