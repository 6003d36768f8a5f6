package com.guardframe.core.xsrf;

import com.guardframe.api.exception.IdentityLookupException;
import com.guardframe.api.http.IncomingRequest;
import com.guardframe.api.security.UserIdStorage;
import com.guardframe.core.config.XsrfConfig;
import com.guardframe.core.event.EventBus;
import com.guardframe.core.event.SecurityEvents;
import com.guardframe.core.http.BufferedIncomingRequest;
import com.guardframe.core.http.InterceptorChain;
import com.guardframe.core.http.RecordingResponseWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XsrfPlugin 单元测试")
class XsrfPluginTest {

    private static final Map<String, List<String>> REJECTION_HEADERS = Map.of(
            "Content-Type", List.of("text/plain; charset=utf-8"),
            "X-Content-Type-Options", List.of("nosniff"));

    private static final UserIdStorage POTATO = () -> "potato";

    private static RecordingResponseWriter handle(XsrfPlugin plugin, IncomingRequest request) {
        RecordingResponseWriter writer = new RecordingResponseWriter();
        new InterceptorChain(List.of(plugin)).before(writer, request);
        return writer;
    }

    private static IncomingRequest formPost(String target, String body) {
        return BufferedIncomingRequest.builder()
                .method("POST")
                .target(target)
                .contentType("application/x-www-form-urlencoded")
                .textBody(body)
                .build();
    }

    private static IncomingRequest multipartPost(String target, String fieldName, String value) {
        String body = "--123\r\n"
                + "Content-Disposition: form-data; name=\"" + fieldName + "\"\r\n"
                + "\r\n"
                + value + "\r\n"
                + "--123--\r\n";
        return BufferedIncomingRequest.builder()
                .method("POST")
                .target(target)
                .contentType("multipart/form-data; boundary=\"123\"")
                .textBody(body)
                .build();
    }

    static Stream<Arguments> tokenCases() {
        return Stream.of(
                Arguments.of("令牌有效", "foo.com", "/pizza", 200, Map.of(), ""),
                Arguments.of("令牌生成时 host 错误", "bar.com", "/pizza", 403, REJECTION_HEADERS, "Forbidden\n"),
                Arguments.of("令牌生成时 path 错误", "foo.com", "/spaghetti", 403, REJECTION_HEADERS, "Forbidden\n"));
    }

    @Nested
    @DisplayName("令牌校验")
    class TokenValidationTests {

        @ParameterizedTest(name = "url-encoded: {0}")
        @MethodSource("com.guardframe.core.xsrf.XsrfPluginTest#tokenCases")
        void urlEncodedPost(String name, String host, String path, int wantStatus,
                            Map<String, List<String>> wantHeaders, String wantBody) {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken(host, path);

            RecordingResponseWriter writer = handle(plugin,
                    formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertEquals(wantStatus, writer.getStatus());
            assertEquals(wantHeaders, writer.getHeaders());
            assertEquals(wantBody, writer.getBody());
        }

        @ParameterizedTest(name = "multipart: {0}")
        @MethodSource("com.guardframe.core.xsrf.XsrfPluginTest#tokenCases")
        void multipartPost(String name, String host, String path, int wantStatus,
                           Map<String, List<String>> wantHeaders, String wantBody) {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken(host, path);

            RecordingResponseWriter writer = handle(plugin,
                    XsrfPluginTest.multipartPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY, token));

            assertEquals(wantStatus, writer.getStatus());
            assertEquals(wantHeaders, writer.getHeaders());
            assertEquals(wantBody, writer.getBody());
        }

        @Test
        @DisplayName("为 /pizza 生成的令牌提交到 /spaghetti 应返回 403")
        void tokenForOtherPathShouldBeForbidden() {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken("foo.com", "/pizza");

            RecordingResponseWriter writer = handle(plugin,
                    formPost("http://foo.com/spaghetti", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertEquals(403, writer.getStatus());
            assertEquals("Forbidden\n", writer.getBody());
        }

        @Test
        @DisplayName("其他用户的令牌应返回 403")
        void tokenForOtherUserShouldBeForbidden() {
            String token = new XsrfPlugin("1234", () -> "tomato").generateToken("foo.com", "/pizza");

            RecordingResponseWriter writer = handle(new XsrfPlugin("1234", POTATO),
                    formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertEquals(403, writer.getStatus());
        }

        @Test
        @DisplayName("其他密钥签发的令牌应返回 403")
        void tokenForOtherSecretShouldBeForbidden() {
            String token = new XsrfPlugin("5678", POTATO).generateToken("foo.com", "/pizza");

            RecordingResponseWriter writer = handle(new XsrfPlugin("1234", POTATO),
                    formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertEquals(403, writer.getStatus());
        }

        @Test
        @DisplayName("有效令牌夹在其他字段之间也应放行")
        void tokenAmongOtherFieldsShouldBeAllowed() {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken("foo.com", "/pizza");

            RecordingResponseWriter writer = handle(plugin,
                    formPost("http://foo.com/pizza", "topping=cheese&" + XsrfPlugin.TOKEN_KEY + "=" + token + "&size=L"));

            assertEquals(200, writer.getStatus());
            assertFalse(writer.isWritten());
        }
    }

    @Nested
    @DisplayName("令牌缺失")
    class MissingTokenTests {

        @Test
        @DisplayName("url-encoded 请求缺少令牌应返回 401")
        void missingTokenInPost() {
            RecordingResponseWriter writer = handle(new XsrfPlugin("1234", POTATO),
                    formPost("http://example.com/", "foo=bar"));

            assertEquals(401, writer.getStatus());
            assertEquals(REJECTION_HEADERS, writer.getHeaders());
            assertEquals("Unauthorized\n", writer.getBody());
        }

        @Test
        @DisplayName("multipart 请求缺少令牌应返回 401")
        void missingTokenInMultipart() {
            RecordingResponseWriter writer = handle(new XsrfPlugin("1234", POTATO),
                    multipartPost("http://example.com/", "foo", "bar"));

            assertEquals(401, writer.getStatus());
            assertEquals(REJECTION_HEADERS, writer.getHeaders());
            assertEquals("Unauthorized\n", writer.getBody());
        }

        @Test
        @DisplayName("空令牌应视为缺失")
        void emptyTokenShouldBeUnauthorized() {
            RecordingResponseWriter writer = handle(new XsrfPlugin("1234", POTATO),
                    formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "="));

            assertEquals(401, writer.getStatus());
        }

        @Test
        @DisplayName("缺少 Content-Type 应返回 401")
        void missingContentTypeShouldBeUnauthorized() {
            IncomingRequest request = BufferedIncomingRequest.builder()
                    .method("POST")
                    .target("http://foo.com/pizza")
                    .textBody(XsrfPlugin.TOKEN_KEY + "=whatever")
                    .build();

            assertEquals(401, handle(new XsrfPlugin("1234", POTATO), request).getStatus());
        }

        @Test
        @DisplayName("不支持的编码应返回 401")
        void unsupportedContentTypeShouldBeUnauthorized() {
            IncomingRequest request = BufferedIncomingRequest.builder()
                    .method("POST")
                    .target("http://foo.com/pizza")
                    .contentType("application/json")
                    .textBody("{\"xsrf-token\":\"abc\"}")
                    .build();

            assertEquals(401, handle(new XsrfPlugin("1234", POTATO), request).getStatus());
        }

        @Test
        @DisplayName("multipart 分界符错误应返回 401")
        void malformedBoundaryShouldBeUnauthorized() {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken("foo.com", "/pizza");
            String body = "--123\r\nContent-Disposition: form-data; name=\"xsrf-token\"\r\n\r\n" + token + "\r\n--123--\r\n";
            IncomingRequest request = BufferedIncomingRequest.builder()
                    .method("POST")
                    .target("http://foo.com/pizza")
                    .contentType("multipart/form-data; boundary=\"456\"")
                    .textBody(body)
                    .build();

            assertEquals(401, handle(plugin, request).getStatus());
        }

        @Test
        @DisplayName("超过请求体上限应返回 401")
        void oversizedBodyShouldBeUnauthorized() {
            XsrfConfig config = XsrfConfig.builder().secret("1234").maxBodySize(16L).build();
            XsrfPlugin plugin = new XsrfPlugin(config, POTATO, null, null);
            String token = plugin.generateToken("foo.com", "/pizza");

            RecordingResponseWriter writer = handle(plugin,
                    formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertEquals(401, writer.getStatus());
        }
    }

    @Nested
    @DisplayName("身份与取消")
    class IdentityTests {

        @Test
        @DisplayName("身份查询失败应返回 500")
        void identityFailureShouldBeServerError() {
            XsrfPlugin plugin = new XsrfPlugin("1234", () -> {
                throw new IdentityLookupException("storage unavailable");
            });

            RecordingResponseWriter writer = handle(plugin, formPost("http://foo.com/pizza", "xsrf-token=abc"));

            assertEquals(500, writer.getStatus());
            assertEquals("Internal Server Error\n", writer.getBody());
            assertEquals(REJECTION_HEADERS, writer.getHeaders());
        }

        @Test
        @DisplayName("身份查询期间请求被取消应返回 500")
        void cancelledRequestShouldBeServerError() {
            XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
            String token = plugin.generateToken("foo.com", "/pizza");
            IncomingRequest delegate = formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token);
            IncomingRequest cancelled = new CancelledRequest(delegate);

            assertEquals(XsrfOutcome.IDENTITY_LOOKUP_FAILED, plugin.validate(cancelled));
            assertEquals(500, handle(plugin, cancelled).getStatus());
        }

        @Test
        @DisplayName("生成令牌时身份查询失败应抛出异常")
        void generateTokenShouldPropagateLookupFailure() {
            XsrfPlugin plugin = new XsrfPlugin("1234", () -> {
                throw new IdentityLookupException("storage unavailable");
            });

            assertThrows(IdentityLookupException.class, () -> plugin.generateToken("foo.com", "/pizza"));
        }
    }

    @Nested
    @DisplayName("方法与事件")
    class MethodAndEventTests {

        @Test
        @DisplayName("安全方法免校验")
        void safeMethodsShouldBeExempt() {
            XsrfPlugin plugin = new XsrfPlugin("1234", () -> {
                throw new IdentityLookupException("must not be called");
            });
            for (String method : List.of("GET", "HEAD", "OPTIONS", "TRACE", "get")) {
                IncomingRequest request = BufferedIncomingRequest.builder()
                        .method(method)
                        .target("http://foo.com/pizza")
                        .build();

                assertEquals(XsrfOutcome.EXEMPT, plugin.validate(request));
            }
        }

        @Test
        @DisplayName("免校验方法可配置")
        void exemptMethodsShouldBeConfigurable() {
            XsrfConfig config = XsrfConfig.builder().secret("1234").exemptMethods(Set.of()).build();
            XsrfPlugin plugin = new XsrfPlugin(config, POTATO, null, null);
            IncomingRequest request = BufferedIncomingRequest.builder()
                    .method("GET")
                    .target("http://foo.com/pizza")
                    .build();

            assertEquals(XsrfOutcome.TOKEN_NOT_PRESENT, plugin.validate(request));
        }

        @Test
        @DisplayName("拒绝时应发布事件")
        void rejectionShouldPublishEvent() {
            EventBus eventBus = new EventBus();
            AtomicReference<SecurityEvents.RequestRejected> received = new AtomicReference<>();
            eventBus.subscribe(SecurityEvents.RequestRejected.class, received::set);
            XsrfPlugin plugin = new XsrfPlugin(XsrfConfig.builder().secret("1234").build(), POTATO, null, eventBus);

            handle(plugin, formPost("http://foo.com/pizza", "xsrf-token=forged"));

            assertNotNull(received.get());
            assertEquals("TOKEN_MISMATCH", received.get().reason());
            assertEquals(403, received.get().status());
            assertEquals("foo.com", received.get().host());
            assertEquals("/pizza", received.get().path());
        }

        @Test
        @DisplayName("放行时不发布事件")
        void allowShouldNotPublishEvent() {
            EventBus eventBus = new EventBus();
            AtomicReference<SecurityEvents.RequestRejected> received = new AtomicReference<>();
            eventBus.subscribe(SecurityEvents.RequestRejected.class, received::set);
            XsrfPlugin plugin = new XsrfPlugin(XsrfConfig.builder().secret("1234").build(), POTATO, null, eventBus);
            String token = plugin.generateToken("foo.com", "/pizza");

            handle(plugin, formPost("http://foo.com/pizza", XsrfPlugin.TOKEN_KEY + "=" + token));

            assertNull(received.get());
        }
    }

    @Test
    @DisplayName("校验后请求体仍可被下游读取")
    void bodyShouldRemainReadableAfterValidation() throws IOException {
        XsrfPlugin plugin = new XsrfPlugin("1234", POTATO);
        String body = "topping=cheese&" + XsrfPlugin.TOKEN_KEY + "=" + plugin.generateToken("foo.com", "/pizza");
        IncomingRequest request = formPost("http://foo.com/pizza", body);

        assertEquals(XsrfOutcome.ALLOWED, plugin.validate(request));
        try (InputStream in = request.openBody()) {
            assertEquals(body, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    private static final class CancelledRequest implements IncomingRequest {
        private final IncomingRequest delegate;

        CancelledRequest(IncomingRequest delegate) {
            this.delegate = delegate;
        }

        @Override
        public String getHost() {
            return delegate.getHost();
        }

        @Override
        public String getPath() {
            return delegate.getPath();
        }

        @Override
        public String getMethod() {
            return delegate.getMethod();
        }

        @Override
        public String getContentType() {
            return delegate.getContentType();
        }

        @Override
        public InputStream openBody() throws IOException {
            return delegate.openBody();
        }

        @Override
        public boolean isCancelled() {
            return true;
        }
    }
}
