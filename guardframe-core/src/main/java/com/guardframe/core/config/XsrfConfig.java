package com.guardframe.core.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * XSRF 插件配置 (Immutable)
 * <p>
 * 职责：作为 XSRF 插件的唯一配置入口，构造后不可修改，可被并发请求无锁读取。
 * 由 Starter 从 {@code guardframe.xsrf.*} 绑定，或由宿主直接构建。
 */
@Getter
@ToString(exclude = "secret")
public class XsrfConfig {

    /**
     * 安全方法默认不做 XSRF 校验
     */
    public static final Set<String> DEFAULT_EXEMPT_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

    /**
     * 默认请求体上限 32 MiB，超出视为未携带令牌
     */
    public static final long DEFAULT_MAX_BODY_SIZE = 32L * 1024 * 1024;

    /**
     * 令牌签名密钥
     */
    private final String secret;

    /**
     * 免校验的 HTTP 方法（大写）
     */
    private final Set<String> exemptMethods;

    /**
     * 提取令牌时最多读取的请求体字节数
     */
    private final long maxBodySize;

    @Builder
    private XsrfConfig(String secret, Set<String> exemptMethods, Long maxBodySize) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("XSRF secret must not be blank");
        }
        if (maxBodySize != null && maxBodySize <= 0) {
            throw new IllegalArgumentException("maxBodySize must be positive: " + maxBodySize);
        }
        this.secret = secret;
        this.exemptMethods = exemptMethods == null
                ? DEFAULT_EXEMPT_METHODS
                : exemptMethods.stream()
                        .map(m -> m.trim().toUpperCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        this.maxBodySize = maxBodySize == null ? DEFAULT_MAX_BODY_SIZE : maxBodySize;
    }

    /**
     * 判断方法是否免校验
     */
    public boolean isExempt(String method) {
        return method != null && exemptMethods.contains(method.toUpperCase(Locale.ROOT));
    }
}
