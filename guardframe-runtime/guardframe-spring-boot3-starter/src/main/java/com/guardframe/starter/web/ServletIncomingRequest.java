package com.guardframe.starter.web;

import com.guardframe.api.http.IncomingRequest;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Servlet 请求适配
 * <p>
 * 请求体由 Servlet 容器持有：表单 POST 从容器已解析的参数重建，其他请求体首次读取后
 * 缓存在请求属性 {@link #BODY_ATTRIBUTE} 中，之后每次返回新的流。
 * multipart 请求体已被容器拆分为 Part，不再提供原始流。
 * Starter 默认使用 {@link ServletFormFieldExtractor}，直接读取容器的解析结果。
 * </p>
 */
public class ServletIncomingRequest implements IncomingRequest {

    public static final String BODY_ATTRIBUTE = ServletIncomingRequest.class.getName() + ".BODY";

    private final HttpServletRequest request;

    public ServletIncomingRequest(HttpServletRequest request) {
        this.request = request;
    }

    public HttpServletRequest getServletRequest() {
        return request;
    }

    @Override
    public String getHost() {
        String host = request.getHeader(HttpHeaders.HOST);
        if (host != null && !host.isBlank()) {
            return host.trim();
        }
        int port = request.getServerPort();
        boolean defaultPort = port <= 0
                || ("http".equals(request.getScheme()) && port == 80)
                || ("https".equals(request.getScheme()) && port == 443);
        return defaultPort ? request.getServerName() : request.getServerName() + ":" + port;
    }

    @Override
    public String getPath() {
        return request.getRequestURI();
    }

    @Override
    public String getMethod() {
        return request.getMethod().toUpperCase(Locale.ROOT);
    }

    @Override
    public String getContentType() {
        return request.getContentType();
    }

    @Override
    public InputStream openBody() throws IOException {
        String contentType = getContentType();
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(MediaType.MULTIPART_FORM_DATA_VALUE)) {
            throw new IOException("Multipart body is owned by the servlet container, read its parts instead");
        }
        byte[] body = (byte[]) request.getAttribute(BODY_ATTRIBUTE);
        if (body == null) {
            // 表单 POST 由 Spring 从参数重建，其余方法读取原始流
            body = StreamUtils.copyToByteArray(new ServletServerHttpRequest(request).getBody());
            request.setAttribute(BODY_ATTRIBUTE, body);
        }
        return new ByteArrayInputStream(body);
    }
}
