package com.guardframe.core.xsrf;

import com.guardframe.api.exception.IdentityLookupException;
import com.guardframe.api.http.IncomingRequest;
import com.guardframe.api.http.ResponseWriter;
import com.guardframe.api.http.Result;
import com.guardframe.api.plugin.InterceptorPlugin;
import com.guardframe.api.security.UserIdStorage;
import com.guardframe.core.config.XsrfConfig;
import com.guardframe.core.event.EventBus;
import com.guardframe.core.event.SecurityEvents;
import com.guardframe.core.form.BodyFormFieldExtractor;
import com.guardframe.core.form.FormFieldExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * XSRF 防护插件
 * <p>
 * 在业务处理器之前执行，校验流程：
 * 1. 安全方法直接放行
 * 2. 解析用户身份，失败 → 500
 * 3. 从请求体提取 {@value #TOKEN_KEY}，缺失 → 401
 * 4. 按请求自身的 host/path 与用户重新计算令牌
 * 5. 常量时间比较，不一致 → 403；一致 → 放行，不写任何内容
 * </p>
 * 插件本身无可变状态，一个实例服务所有并发请求。
 */
@Slf4j
public class XsrfPlugin implements InterceptorPlugin {

    /**
     * 渲染端与校验端共享的表单字段名
     */
    public static final String TOKEN_KEY = "xsrf-token";

    private final XsrfConfig config;
    private final XsrfTokenGenerator generator;
    private final FormFieldExtractor extractor;
    private final EventBus eventBus;

    public XsrfPlugin(String secret, UserIdStorage userIdStorage) {
        this(XsrfConfig.builder().secret(secret).build(), userIdStorage, null, null);
    }

    /**
     * @param extractor 为 null 时使用 {@link BodyFormFieldExtractor}
     * @param eventBus  为 null 时不发布拒绝事件
     */
    public XsrfPlugin(XsrfConfig config, UserIdStorage userIdStorage,
                      FormFieldExtractor extractor, EventBus eventBus) {
        this.config = Objects.requireNonNull(config, "config");
        this.generator = new XsrfTokenGenerator(config.getSecret(), userIdStorage);
        this.extractor = extractor != null ? extractor : new BodyFormFieldExtractor(config.getMaxBodySize());
        this.eventBus = eventBus;
    }

    /**
     * 为当前用户生成令牌，供页面渲染时嵌入表单
     *
     * @throws IdentityLookupException 如果无法解析当前用户
     */
    public String generateToken(String host, String path) {
        return generator.generate(host, path);
    }

    @Override
    public Result before(ResponseWriter writer, IncomingRequest request) {
        XsrfOutcome outcome = validate(request);
        if (outcome.isAllowed()) {
            return Result.proceed();
        }
        log.warn("XSRF check rejected {} {}{}: {}", request.getMethod(), request.getHost(), request.getPath(), outcome);
        if (eventBus != null) {
            eventBus.publish(new SecurityEvents.RequestRejected(
                    getClass().getSimpleName(), request.getMethod(), request.getHost(), request.getPath(),
                    outcome.name(), outcome.getStatus().getCode()));
        }
        if (outcome.getStatus().isServerError()) {
            return writer.serverError(outcome.getStatus());
        }
        return writer.clientError(outcome.getStatus());
    }

    /**
     * 执行校验但不写响应
     */
    public XsrfOutcome validate(IncomingRequest request) {
        if (config.isExempt(request.getMethod())) {
            return XsrfOutcome.EXEMPT;
        }

        String userId;
        try {
            userId = generator.resolveUserId();
        } catch (IdentityLookupException e) {
            log.error("XSRF check could not resolve user for {} {}", request.getMethod(), request.getPath(), e);
            return XsrfOutcome.IDENTITY_LOOKUP_FAILED;
        }
        if (request.isCancelled()) {
            log.warn("Request {} {} cancelled during user lookup", request.getMethod(), request.getPath());
            return XsrfOutcome.IDENTITY_LOOKUP_FAILED;
        }

        Optional<String> presented = extractor.extract(request, TOKEN_KEY);
        if (presented.isEmpty() || presented.get().isEmpty()) {
            return XsrfOutcome.TOKEN_NOT_PRESENT;
        }

        String expected = generator.token(request.getHost(), request.getPath(), userId);
        if (!XsrfTokenGenerator.matches(presented.get(), expected)) {
            return XsrfOutcome.TOKEN_MISMATCH;
        }
        log.debug("XSRF token accepted for {} {}", request.getMethod(), request.getPath());
        return XsrfOutcome.ALLOWED;
    }

    public XsrfConfig getConfig() {
        return config;
    }
}
