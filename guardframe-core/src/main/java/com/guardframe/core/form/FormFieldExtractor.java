package com.guardframe.core.form;

import com.guardframe.api.http.IncomingRequest;

import java.util.Optional;

/**
 * 表单字段提取器 SPI
 * <p>
 * 从请求体中提取单个字段的值。无法识别的编码、格式错误、字段缺失都返回空，
 * 不抛出异常；实现不能破坏下游处理器对请求体的读取。
 * </p>
 */
public interface FormFieldExtractor {

    Optional<String> extract(IncomingRequest request, String fieldName);
}
