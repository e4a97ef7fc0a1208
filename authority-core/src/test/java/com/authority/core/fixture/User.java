package com.authority.core.fixture;

/**
 * 测试用户，类型名解析为 "User"
 */
public record User(int id, String name) {
}
