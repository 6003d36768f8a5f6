package com.guardframe.api.http;

/**
 * 插件可见的响应写入器
 *
 * @author GuardFrame
 */
public interface ResponseWriter {

    /**
     * 获取基于声明的响应头 API
     */
    ResponseHeaders header();

    /**
     * 写出 4xx 错误响应
     * <p>
     * 写出内容：状态码、{@code Content-Type: text/plain; charset=utf-8}、
     * {@code X-Content-Type-Options: nosniff}，以及正文 {@code <原因短语>\n}。
     * </p>
     *
     * @param status 必须是 4xx 状态
     * @return 已写出的结果，调用方应直接返回
     */
    Result clientError(ResponseStatus status);

    /**
     * 写出 5xx 错误响应，格式同 {@link #clientError(ResponseStatus)}
     *
     * @param status 必须是 5xx 状态
     */
    Result serverError(ResponseStatus status);

    /**
     * 响应是否已经写出
     */
    boolean isWritten();
}
