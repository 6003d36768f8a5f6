package com.guardframe.api.http;

import java.io.IOException;
import java.io.InputStream;

/**
 * 插件可见的入站请求
 * <p>
 * 请求体必须可重复读取：每次调用 {@link #openBody()} 都返回一个从头开始的新流，
 * 插件读取请求体不能影响下游处理器。
 * </p>
 *
 * @author GuardFrame
 */
public interface IncomingRequest {

    /**
     * 请求目标主机，例如 {@code foo.com}
     */
    String getHost();

    /**
     * 请求路径，不含查询串，例如 {@code /pizza}
     */
    String getPath();

    /**
     * HTTP 方法（大写）
     */
    String getMethod();

    /**
     * 声明的 Content-Type，缺失时返回 null
     */
    String getContentType();

    /**
     * 打开一个从头读取请求体的新流
     */
    InputStream openBody() throws IOException;

    /**
     * 请求是否已被宿主取消（超时、客户端断开等）
     * <p>
     * 默认以当前线程的中断标记作为取消信号。
     * </p>
     */
    default boolean isCancelled() {
        return Thread.currentThread().isInterrupted();
    }
}
