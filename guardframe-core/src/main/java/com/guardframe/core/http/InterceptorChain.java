package com.guardframe.core.http;

import com.guardframe.api.http.IncomingRequest;
import com.guardframe.api.http.ResponseStatus;
import com.guardframe.api.http.ResponseWriter;
import com.guardframe.api.http.Result;
import com.guardframe.api.plugin.InterceptorPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 前置插件链
 * <p>
 * 按顺序调用插件，第一个已写出的结果短路整条链。
 * 插件抛出的意外异常一律转为 500，绝不回退为放行。
 * </p>
 */
@Slf4j
public class InterceptorChain {

    private final List<InterceptorPlugin> plugins;

    public InterceptorChain(List<? extends InterceptorPlugin> plugins) {
        this.plugins = List.copyOf(plugins);
    }

    public Result before(ResponseWriter writer, IncomingRequest request) {
        for (InterceptorPlugin plugin : plugins) {
            Result result;
            try {
                result = plugin.before(writer, request);
            } catch (RuntimeException e) {
                log.error("Plugin [{}] failed on {} {}", plugin.getClass().getSimpleName(),
                        request.getMethod(), request.getPath(), e);
                return fail(writer);
            }
            if (result == null) {
                log.error("Plugin [{}] returned no result", plugin.getClass().getSimpleName());
                return fail(writer);
            }
            if (result.isWritten()) {
                log.debug("Plugin [{}] short-circuited {} {} with {}", plugin.getClass().getSimpleName(),
                        request.getMethod(), request.getPath(), result);
                return result;
            }
        }
        return Result.proceed();
    }

    public List<InterceptorPlugin> getPlugins() {
        return plugins;
    }

    private static Result fail(ResponseWriter writer) {
        if (writer.isWritten()) {
            // 插件已写出响应后才失败，只能保持已写出的状态
            return Result.written(ResponseStatus.INTERNAL_SERVER_ERROR);
        }
        return writer.serverError(ResponseStatus.INTERNAL_SERVER_ERROR);
    }
}
