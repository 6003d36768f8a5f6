package com.guardframe.api.exception;

/**
 * 响应头声明冲突
 * 同一个响应头已被其他组件声明（claim）时抛出，属于管线配置错误而非客户端错误。
 *
 * @author GuardFrame
 */
public class HeaderClaimConflictException extends GuardException {

    private final String headerName;

    public HeaderClaimConflictException(String headerName) {
        super("Header [" + headerName + "] is already claimed");
        this.headerName = headerName;
    }

    public String getHeaderName() {
        return headerName;
    }
}
