package com.authority.api.exception;

/**
 * 别名未找到异常
 * 当请求的动作别名从未注册时抛出此异常。
 */
public class AliasNotFoundException extends AuthorityException {

    private final String aliasName;

    public AliasNotFoundException(String aliasName) {
        super("Alias not found: " + aliasName);
        this.aliasName = aliasName;
    }

    public String getAliasName() {
        return aliasName;
    }
}
