package com.guardframe.starter.configuration;

import com.guardframe.api.plugin.InterceptorPlugin;
import com.guardframe.api.security.UserIdStorage;
import com.guardframe.core.config.XsrfConfig;
import com.guardframe.core.event.EventBus;
import com.guardframe.core.form.FormFieldExtractor;
import com.guardframe.core.headers.StaticHeadersPlugin;
import com.guardframe.core.http.InterceptorChain;
import com.guardframe.core.xsrf.XsrfPlugin;
import com.guardframe.starter.config.GuardFrameProperties;
import com.guardframe.starter.interceptor.GuardWebInterceptor;
import com.guardframe.starter.web.ServletFormFieldExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Slf4j
@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(GuardFrameProperties.class)
@ConditionalOnProperty(prefix = "guardframe", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GuardFrameAutoConfiguration {

    // 将事件总线注册为 Bean，宿主可订阅拒绝事件
    @Bean
    @ConditionalOnMissingBean
    public EventBus guardEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean(FormFieldExtractor.class)
    public FormFieldExtractor servletFormFieldExtractor(GuardFrameProperties properties) {
        return new ServletFormFieldExtractor(properties.getXsrf().getMaxBodySize().toBytes());
    }

    @Bean
    @Order(100)
    @ConditionalOnProperty(prefix = "guardframe.static-headers", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StaticHeadersPlugin staticHeadersPlugin() {
        return new StaticHeadersPlugin();
    }

    // 用户身份由宿主提供，没有 UserIdStorage 时不启用 XSRF
    @Bean
    @Order(200)
    @ConditionalOnBean(UserIdStorage.class)
    @ConditionalOnProperty(prefix = "guardframe.xsrf", name = "enabled", havingValue = "true", matchIfMissing = true)
    public XsrfPlugin xsrfPlugin(GuardFrameProperties properties,
                                 UserIdStorage userIdStorage,
                                 FormFieldExtractor formFieldExtractor,
                                 EventBus guardEventBus) {
        GuardFrameProperties.Xsrf xsrf = properties.getXsrf();
        if (!StringUtils.hasText(xsrf.getSecret())) {
            throw new IllegalStateException(
                    "guardframe.xsrf.secret must be set when XSRF protection is enabled");
        }
        XsrfConfig config = XsrfConfig.builder()
                .secret(xsrf.getSecret())
                .exemptMethods(xsrf.getExemptMethods())
                .maxBodySize(xsrf.getMaxBodySize().toBytes())
                .build();
        log.info("GuardFrame XSRF protection enabled: {}", config);
        return new XsrfPlugin(config, userIdStorage, formFieldExtractor, guardEventBus);
    }

    // 组装插件链：收集容器中所有的 InterceptorPlugin，按 @Order 排序
    @Bean
    public InterceptorChain guardInterceptorChain(ObjectProvider<InterceptorPlugin> plugins) {
        InterceptorChain chain = new InterceptorChain(plugins.orderedStream().toList());
        log.info("GuardFrame plugins: {}", chain.getPlugins().stream()
                .map(p -> p.getClass().getSimpleName())
                .toList());
        return chain;
    }

    @Bean
    public GuardWebInterceptor guardWebInterceptor(InterceptorChain guardInterceptorChain) {
        return new GuardWebInterceptor(guardInterceptorChain);
    }

    @Bean
    public WebMvcConfigurer guardWebMvcConfigurer(GuardWebInterceptor guardWebInterceptor,
                                                  GuardFrameProperties properties) {
        return new WebMvcConfigurer() {
            @Override
            public void addInterceptors(InterceptorRegistry registry) {
                registry.addInterceptor(guardWebInterceptor)
                        .addPathPatterns(properties.getPathPatterns())
                        .excludePathPatterns(properties.getExcludePathPatterns())
                        .order(Ordered.HIGHEST_PRECEDENCE);
            }
        };
    }
}
