package com.guardframe.core.http;

import com.guardframe.api.exception.HeaderClaimConflictException;
import com.guardframe.api.http.HeaderSetter;
import com.guardframe.api.http.ResponseHeaders;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于声明的响应头实现，每个响应一个实例
 * <p>
 * 头名称大小写不敏感；同一名称只允许声明一次。
 * </p>
 */
public class ClaimableHeaders implements ResponseHeaders {

    private final HeaderSink sink;
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public ClaimableHeaders(HeaderSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public HeaderSetter claim(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be blank");
        }
        if (!claimed.add(canonical(name))) {
            throw new HeaderClaimConflictException(name);
        }
        return values -> sink.setHeader(name, List.copyOf(values));
    }

    @Override
    public boolean isClaimed(String name) {
        return name != null && claimed.contains(canonical(name));
    }

    private static String canonical(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
