package com.guardframe.starter.interceptor;

import com.guardframe.api.http.Result;
import com.guardframe.core.http.InterceptorChain;
import com.guardframe.starter.web.ServletIncomingRequest;
import com.guardframe.starter.web.ServletResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 统一 Web 层安全拦截器
 * 在 Controller 执行之前运行 GuardFrame 插件链：
 * 1. 为本次请求创建响应写入器
 * 2. 依次执行插件
 * 3. 任一插件写出响应则中断请求，不再进入 Controller
 */
@Slf4j
@RequiredArgsConstructor
public class GuardWebInterceptor implements HandlerInterceptor {

    private final InterceptorChain chain;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        ServletResponseWriter writer = new ServletResponseWriter(response);

        Result result = chain.before(writer, new ServletIncomingRequest(request));
        if (result.isWritten()) {
            log.debug("[GuardWeb] {} {} stopped with {}", request.getMethod(), request.getRequestURI(), result);
            return false;
        }
        return true;
    }
}
