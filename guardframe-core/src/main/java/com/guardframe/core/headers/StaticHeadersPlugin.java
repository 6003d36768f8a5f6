package com.guardframe.core.headers;

import com.guardframe.api.exception.HeaderClaimConflictException;
import com.guardframe.api.http.HeaderSetter;
import com.guardframe.api.http.IncomingRequest;
import com.guardframe.api.http.ResponseStatus;
import com.guardframe.api.http.ResponseWriter;
import com.guardframe.api.http.Result;
import com.guardframe.api.plugin.InterceptorPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 静态响应头插件，对每个请求声明并设置：
 * <ul>
 *     <li>{@code X-Content-Type-Options: nosniff}</li>
 *     <li>{@code X-XSS-Protection: 0}</li>
 * </ul>
 * 声明失败说明管线配置错误，返回 500 而不是跳过。
 */
@Slf4j
public class StaticHeadersPlugin implements InterceptorPlugin {

    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    public static final String X_XSS_PROTECTION = "X-XSS-Protection";

    @Override
    public Result before(ResponseWriter writer, IncomingRequest request) {
        try {
            HeaderSetter xcto = writer.header().claim(X_CONTENT_TYPE_OPTIONS);
            xcto.set(List.of("nosniff"));

            HeaderSetter xxp = writer.header().claim(X_XSS_PROTECTION);
            xxp.set(List.of("0"));
        } catch (HeaderClaimConflictException e) {
            log.error("Static header [{}] already claimed by another component", e.getHeaderName());
            return writer.serverError(ResponseStatus.INTERNAL_SERVER_ERROR);
        }
        return Result.proceed();
    }
}
