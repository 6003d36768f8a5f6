package com.guardframe.core.form;

import com.guardframe.api.http.IncomingRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Optional;

/**
 * 默认表单字段提取器：直接解析原始请求体
 * <p>
 * 支持 url-encoded 与 multipart 两种编码，按 Content-Type 分派。
 * 通过 {@link IncomingRequest#openBody()} 读取独立的流，原请求体保持可读。
 * 所有解析失败（缺少 Content-Type、分界符非法、请求体截断或超限）都折叠为"未找到"。
 * </p>
 */
@Slf4j
public class BodyFormFieldExtractor implements FormFieldExtractor {

    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
    public static final String MULTIPART_FORM_DATA = "multipart/form-data";

    private final long maxBodySize;

    public BodyFormFieldExtractor(long maxBodySize) {
        if (maxBodySize <= 0) {
            throw new IllegalArgumentException("maxBodySize must be positive: " + maxBodySize);
        }
        this.maxBodySize = maxBodySize;
    }

    @Override
    public Optional<String> extract(IncomingRequest request, String fieldName) {
        MediaTypeHeader contentType = MediaTypeHeader.parse(request.getContentType());
        if (contentType == null) {
            log.debug("No usable Content-Type on {} {}", request.getMethod(), request.getPath());
            return Optional.empty();
        }

        switch (contentType.getValue()) {
            case FORM_URLENCODED: {
                Charset charset = charsetOf(contentType);
                byte[] body = readBody(request);
                if (charset == null || body == null) {
                    return Optional.empty();
                }
                try {
                    return UrlEncodedFormParser.findFirst(body, charset, fieldName);
                } catch (IllegalArgumentException e) {
                    log.debug("Malformed url-encoded body: {}", e.getMessage());
                    return Optional.empty();
                }
            }
            case MULTIPART_FORM_DATA: {
                String boundary = contentType.getParameter("boundary");
                if (!MultipartFormParser.isValidBoundary(boundary)) {
                    log.debug("Malformed multipart boundary on {} {}", request.getMethod(), request.getPath());
                    return Optional.empty();
                }
                byte[] body = readBody(request);
                return body == null ? Optional.empty() : MultipartFormParser.findFirst(body, boundary, fieldName);
            }
            default:
                log.debug("Unsupported Content-Type [{}]", contentType.getValue());
                return Optional.empty();
        }
    }

    /**
     * @return 请求体字节；读取失败或超过上限时返回 null
     */
    private byte[] readBody(IncomingRequest request) {
        try (InputStream in = request.openBody()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            long total = 0;
            int n;
            while ((n = in.read(buffer)) != -1) {
                total += n;
                if (total > maxBodySize) {
                    log.warn("Request body of {} {} exceeds {} bytes, token not extracted",
                            request.getMethod(), request.getPath(), maxBodySize);
                    return null;
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (IOException e) {
            log.warn("Failed to read request body of {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
            return null;
        }
    }

    private static Charset charsetOf(MediaTypeHeader contentType) {
        String name = contentType.getParameter("charset");
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }
}
