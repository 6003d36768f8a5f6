package com.guardframe.starter.config;

import com.guardframe.core.config.XsrfConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Setter
@Getter
@ConfigurationProperties(prefix = "guardframe")
public class GuardFrameProperties {

    /**
     * 是否启用 GuardFrame
     */
    private boolean enabled = true;

    /**
     * 拦截的路径模式
     */
    private List<String> pathPatterns = new ArrayList<>(List.of("/**"));

    /**
     * 排除的路径模式，例如健康检查
     */
    private List<String> excludePathPatterns = new ArrayList<>();

    private StaticHeaders staticHeaders = new StaticHeaders();

    private Xsrf xsrf = new Xsrf();

    @Setter
    @Getter
    public static class StaticHeaders {
        private boolean enabled = true;
    }

    @Setter
    @Getter
    public static class Xsrf {
        /**
         * 需要宿主同时提供 UserIdStorage Bean
         */
        private boolean enabled = true;

        /**
         * 令牌签名密钥，启用时必填
         */
        private String secret;

        private Set<String> exemptMethods = new LinkedHashSet<>(XsrfConfig.DEFAULT_EXEMPT_METHODS);

        private DataSize maxBodySize = DataSize.ofBytes(XsrfConfig.DEFAULT_MAX_BODY_SIZE);
    }
}
