package com.guardframe.core.http;

import com.guardframe.api.http.ResponseHeaders;
import com.guardframe.api.http.ResponseStatus;
import com.guardframe.api.http.ResponseWriter;
import com.guardframe.api.http.Result;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 响应写入器骨架
 * <p>
 * 统一错误响应格式：状态码 + 两个固定响应头 + {@code <原因短语>\n}。
 * 固定响应头直接写入底层，不经过声明机制。每个写入器只能写出一次。
 * </p>
 */
public abstract class AbstractResponseWriter implements ResponseWriter {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String X_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    public static final String NOSNIFF = "nosniff";

    private final HeaderSink sink;
    private final ClaimableHeaders headers;
    private final AtomicBoolean written = new AtomicBoolean(false);

    protected AbstractResponseWriter(HeaderSink sink) {
        this.sink = sink;
        this.headers = new ClaimableHeaders(sink);
    }

    @Override
    public ResponseHeaders header() {
        return headers;
    }

    @Override
    public Result clientError(ResponseStatus status) {
        if (!status.isClientError()) {
            throw new IllegalArgumentException("Not a client error status: " + status.getCode());
        }
        return writeError(status);
    }

    @Override
    public Result serverError(ResponseStatus status) {
        if (!status.isServerError()) {
            throw new IllegalArgumentException("Not a server error status: " + status.getCode());
        }
        return writeError(status);
    }

    @Override
    public boolean isWritten() {
        return written.get();
    }

    private Result writeError(ResponseStatus status) {
        if (!written.compareAndSet(false, true)) {
            throw new IllegalStateException("Response has already been written");
        }
        sink.setHeader(CONTENT_TYPE, List.of(TEXT_PLAIN_UTF8));
        sink.setHeader(X_CONTENT_TYPE_OPTIONS, List.of(NOSNIFF));
        writeStatus(status.getCode());
        try {
            writeBody((status.getReasonPhrase() + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write error response", e);
        }
        return Result.written(status);
    }

    protected abstract void writeStatus(int code);

    protected abstract void writeBody(byte[] body) throws IOException;
}
