package com.authority.api.resource;

/**
 * 自描述资源
 * <p>
 * 实现该接口的资源值自行声明类型名，默认解析器不再使用其类名。
 * 适用于代理类、动态生成类或需要与类名解耦的领域对象。
 * </p>
 */
public interface Resource {

    String getResourceType();
}
