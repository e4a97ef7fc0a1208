package com.authority.api.resource;

import com.authority.api.exception.InvalidArgumentException;

/**
 * 资源引用：要么是类型名，要么是具体的资源值
 * <p>
 * 引擎在查询前将其归一化为 (类型名, 可选资源值)。
 * 值引用的类型名由 {@link com.authority.api.spi.ResourceTypeResolver} 推导。
 * </p>
 *
 * @author Authority
 */
public sealed interface ResourceRef permits ResourceRef.TypeName, ResourceRef.Value {

    /**
     * 通配资源类型：规则以此声明时匹配任意资源
     */
    String ALL = "all";

    static ResourceRef type(String typeName) {
        return new TypeName(typeName);
    }

    static ResourceRef value(Object value) {
        return new Value(value);
    }

    static ResourceRef all() {
        return new TypeName(ALL);
    }

    /**
     * 按类型名引用资源，例如 "User"
     */
    record TypeName(String name) implements ResourceRef {
        public TypeName {
            InvalidArgumentException.requireText("resourceType", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * 按具体值引用资源，值本身可为 null（解析时视为无法解析）
     */
    record Value(Object value) implements ResourceRef {
        @Override
        public String toString() {
            return "value(" + (value == null ? "null" : value.getClass().getName()) + ")";
        }
    }
}
