package com.authority.api.exception;

/**
 * 无效参数异常
 * 当传入的动作名、资源类型或配置项不满足要求时抛出此异常。
 */
public class InvalidArgumentException extends AuthorityException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String message) {
        super(message);
        this.paramName = null;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        super(message, cause);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }

    /**
     * 校验字符串参数非空白
     *
     * @return 原值，便于链式赋值
     */
    public static String requireText(String paramName, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(paramName, value, paramName + " must not be blank");
        }
        return value;
    }
}
