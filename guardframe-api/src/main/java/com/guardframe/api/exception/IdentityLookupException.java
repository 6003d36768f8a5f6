package com.guardframe.api.exception;

/**
 * 身份查询异常
 * 当宿主提供的 {@link com.guardframe.api.security.UserIdStorage} 无法解析当前用户时抛出。
 * 插件不会重试，统一映射为 500。
 *
 * @author GuardFrame
 */
public class IdentityLookupException extends GuardException {

    public IdentityLookupException(String message) {
        super(message);
    }

    public IdentityLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
