package com.guardframe.core.event;

import com.guardframe.api.event.GuardEvent;

/**
 * 安全相关事件
 */
public final class SecurityEvents {

    private SecurityEvents() {
    }

    /**
     * 请求被插件拒绝
     *
     * @param plugin 拒绝请求的插件
     * @param method HTTP 方法
     * @param host   请求主机
     * @param path   请求路径
     * @param reason 拒绝原因，例如 TOKEN_MISMATCH
     * @param status 写出的状态码
     */
    public record RequestRejected(String plugin, String method, String host, String path,
                                  String reason, int status) implements GuardEvent {
    }
}
