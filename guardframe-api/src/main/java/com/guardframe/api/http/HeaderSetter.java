package com.guardframe.api.http;

import java.util.List;

/**
 * 已声明响应头的写入器
 * 每次调用按顺序替换该响应头的全部取值。
 *
 * @author GuardFrame
 */
@FunctionalInterface
public interface HeaderSetter {

    void set(List<String> values);
}
