package com.authority.api.exception;

/**
 * 鉴权引擎异常基类
 * <p>
 * 所有引擎抛出的异常均为非受检异常，调用方按需捕获。
 * </p>
 *
 * @author Authority
 */
public class AuthorityException extends RuntimeException {

    public AuthorityException(String message) {
        super(message);
    }

    public AuthorityException(String message, Throwable cause) {
        super(message, cause);
    }
}
