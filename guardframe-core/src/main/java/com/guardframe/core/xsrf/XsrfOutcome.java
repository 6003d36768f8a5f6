package com.guardframe.core.xsrf;

import com.guardframe.api.http.ResponseStatus;

/**
 * XSRF 校验的终态
 */
public enum XsrfOutcome {

    /** 令牌匹配，放行 */
    ALLOWED(null),

    /** 安全方法，未校验直接放行 */
    EXEMPT(null),

    /** 身份查询失败或请求被取消 */
    IDENTITY_LOOKUP_FAILED(ResponseStatus.INTERNAL_SERVER_ERROR),

    /** 请求体中没有可用令牌（含各种解析失败） */
    TOKEN_NOT_PRESENT(ResponseStatus.UNAUTHORIZED),

    /** 令牌存在但与重新计算的值不一致 */
    TOKEN_MISMATCH(ResponseStatus.FORBIDDEN);

    private final ResponseStatus status;

    XsrfOutcome(ResponseStatus status) {
        this.status = status;
    }

    /**
     * 拒绝时写出的状态；放行时为 null
     */
    public ResponseStatus getStatus() {
        return status;
    }

    public boolean isAllowed() {
        return status == null;
    }
}
