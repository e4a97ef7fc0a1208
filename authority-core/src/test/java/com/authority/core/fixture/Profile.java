package com.authority.core.fixture;

/**
 * 与 User 同构但类型名不同的测试值
 */
public record Profile(int id) {
}
