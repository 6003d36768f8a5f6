package com.guardframe.api.plugin;

import com.guardframe.api.http.IncomingRequest;
import com.guardframe.api.http.ResponseWriter;
import com.guardframe.api.http.Result;

/**
 * 前置拦截插件
 * 宿主管线在任何业务处理器执行之前调用 {@link #before}。
 *
 * @author GuardFrame
 */
public interface InterceptorPlugin {

    /**
     * 前置钩子
     *
     * @param writer  响应写入器
     * @param request 入站请求
     * @return {@link Result#proceed()} 表示继续；已写出的结果表示短路
     */
    Result before(ResponseWriter writer, IncomingRequest request);
}
