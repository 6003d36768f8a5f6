package com.guardframe.core.http;

import com.guardframe.api.http.IncomingRequest;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * 请求体已完整缓冲在内存中的请求
 * <p>
 * 每次 {@link #openBody()} 返回独立的流，可供插件与下游处理器重复读取。
 * </p>
 */
@Getter
public class BufferedIncomingRequest implements IncomingRequest {

    private final String host;
    private final String path;
    private final String method;
    private final String contentType;
    @Getter(AccessLevel.NONE)
    private final byte[] body;

    @Builder
    private BufferedIncomingRequest(String host, String path, String method, String contentType, byte[] body) {
        this.host = Objects.requireNonNull(host, "host");
        this.path = path == null || path.isEmpty() ? "/" : path;
        this.method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        this.contentType = contentType;
        this.body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public InputStream openBody() {
        return new ByteArrayInputStream(body);
    }

    public static class BufferedIncomingRequestBuilder {

        /**
         * 从绝对 URL 设置 host 与 path，例如 {@code http://foo.com/pizza}
         */
        public BufferedIncomingRequestBuilder target(String url) {
            URI uri = URI.create(url);
            if (uri.getHost() != null) {
                this.host = uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
            }
            this.path = uri.getRawPath();
            return this;
        }

        public BufferedIncomingRequestBuilder textBody(String text) {
            this.body = text.getBytes(StandardCharsets.UTF_8);
            return this;
        }
    }
}
