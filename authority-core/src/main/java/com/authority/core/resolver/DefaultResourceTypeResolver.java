package com.authority.core.resolver;

import com.authority.api.exception.UnresolvableResourceException;
import com.authority.api.resource.Resource;
import com.authority.api.spi.ResourceTypeResolver;

/**
 * 默认资源类型解析器
 * <ul>
 *     <li>实现 {@link Resource} 的值使用其自报的类型名</li>
 *     <li>其余按 {@link TypeNaming} 取类名</li>
 *     <li>null、匿名类、Lambda 等取不到稳定名字的值视为无法解析</li>
 * </ul>
 */
public class DefaultResourceTypeResolver implements ResourceTypeResolver {

    private final TypeNaming typeNaming;

    public DefaultResourceTypeResolver() {
        this(TypeNaming.SIMPLE_NAME);
    }

    public DefaultResourceTypeResolver(TypeNaming typeNaming) {
        this.typeNaming = typeNaming == null ? TypeNaming.SIMPLE_NAME : typeNaming;
    }

    @Override
    public String resolve(Object value) {
        if (value == null) {
            throw new UnresolvableResourceException(null, "Cannot resolve resource type of null");
        }
        if (value instanceof Resource) {
            String declared = ((Resource) value).getResourceType();
            if (declared == null || declared.isBlank()) {
                throw new UnresolvableResourceException(value.getClass(),
                        "Resource " + value.getClass().getName() + " declared a blank resource type");
            }
            return declared;
        }
        return nameOf(value.getClass());
    }

    @Override
    public String nameOf(Class<?> type) {
        if (type == null) {
            throw new UnresolvableResourceException(null, "Cannot resolve resource type of null class");
        }
        if (type.isAnonymousClass() || type.isSynthetic() || type.isHidden()) {
            throw new UnresolvableResourceException(type,
                    "No stable resource type name for " + type.getName());
        }
        String name = typeNaming == TypeNaming.QUALIFIED_NAME ? type.getName() : type.getSimpleName();
        if (name.isEmpty()) {
            throw new UnresolvableResourceException(type, "Empty type name for " + type.getName());
        }
        return name;
    }

    public TypeNaming getTypeNaming() {
        return typeNaming;
    }
}
