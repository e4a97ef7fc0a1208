package com.authority.core.resolver;

/**
 * 由类推导资源类型名的方式
 */
public enum TypeNaming {

    /**
     * 简单类名，例如 "User"
     */
    SIMPLE_NAME,

    /**
     * 全限定类名，例如 "com.example.User"
     */
    QUALIFIED_NAME
}
