package com.guardframe.core.http;

import java.util.List;

/**
 * 底层响应头写入目标，由具体容器适配实现
 */
@FunctionalInterface
public interface HeaderSink {

    /**
     * 按顺序替换响应头的全部取值；空列表表示移除
     */
    void setHeader(String name, List<String> values);
}
