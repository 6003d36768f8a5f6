package com.guardframe.starter.web;

import com.guardframe.api.http.IncomingRequest;
import com.guardframe.core.form.FormFieldExtractor;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.Part;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Servlet 容器解析结果的表单字段提取器
 * <p>
 * 容器对表单参数与 multipart Part 做了缓冲，读取后下游处理器仍能拿到完整表单。
 * 只接受请求体中的值：Servlet 规范保证查询串参数排在请求体参数之前，
 * 据此剔除来自查询串的同名值。
 * </p>
 */
@Slf4j
public class ServletFormFieldExtractor implements FormFieldExtractor {

    private final long maxBodySize;

    public ServletFormFieldExtractor(long maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    @Override
    public Optional<String> extract(IncomingRequest request, String fieldName) {
        if (!(request instanceof ServletIncomingRequest servletRequest)) {
            throw new IllegalArgumentException("Expected a servlet request but got " + request.getClass().getName());
        }
        HttpServletRequest raw = servletRequest.getServletRequest();

        MediaType contentType;
        try {
            if (raw.getContentType() == null) {
                return Optional.empty();
            }
            contentType = MediaType.parseMediaType(raw.getContentType());
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparseable Content-Type [{}]", raw.getContentType());
            return Optional.empty();
        }
        if (raw.getContentLengthLong() > maxBodySize) {
            log.warn("Request body of {} {} exceeds {} bytes, token not extracted",
                    raw.getMethod(), raw.getRequestURI(), maxBodySize);
            return Optional.empty();
        }

        if (MediaType.APPLICATION_FORM_URLENCODED.includes(contentType)) {
            return fromBodyParameters(raw, fieldName);
        }
        if (MediaType.MULTIPART_FORM_DATA.includes(contentType)) {
            return fromPart(raw, fieldName);
        }
        log.debug("Unsupported Content-Type [{}]", contentType);
        return Optional.empty();
    }

    private Optional<String> fromBodyParameters(HttpServletRequest request, String fieldName) {
        String[] values = request.getParameterValues(fieldName);
        if (values == null) {
            return Optional.empty();
        }
        int fromQuery = countQueryValues(request.getQueryString(), fieldName);
        return values.length > fromQuery ? Optional.of(values[fromQuery]) : Optional.empty();
    }

    private Optional<String> fromPart(HttpServletRequest request, String fieldName) {
        try {
            Part part = request.getPart(fieldName);
            if (part == null || part.getSubmittedFileName() != null) {
                return Optional.empty();
            }
            try (InputStream in = part.getInputStream()) {
                return Optional.of(StreamUtils.copyToString(in, charsetOf(part, request)));
            }
        } catch (IOException | ServletException | IllegalStateException | IllegalArgumentException e) {
            // IllegalStateException: 未配置 multipart 或超出容器限制；IllegalArgumentException: 字符集非法
            log.debug("Multipart body of {} {} not readable: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            return Optional.empty();
        }
    }

    private static int countQueryValues(String queryString, String fieldName) {
        if (queryString == null || queryString.isEmpty()) {
            return 0;
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.newInstance()
                .query(queryString)
                .build()
                .getQueryParams();
        int count = 0;
        for (var entry : params.entrySet()) {
            if (fieldName.equals(decode(entry.getKey()))) {
                List<String> values = entry.getValue();
                count += values.size();
            }
        }
        return count;
    }

    private static String decode(String raw) {
        try {
            return UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static Charset charsetOf(Part part, HttpServletRequest request) {
        if (part.getContentType() != null) {
            try {
                Charset charset = MediaType.parseMediaType(part.getContentType()).getCharset();
                if (charset != null) {
                    return charset;
                }
            } catch (InvalidMediaTypeException e) {
                log.debug("Ignoring unparseable part Content-Type [{}]", part.getContentType());
            }
        }
        return request.getCharacterEncoding() != null
                ? Charset.forName(request.getCharacterEncoding())
                : StandardCharsets.UTF_8;
    }
}
