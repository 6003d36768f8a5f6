package com.guardframe.api.http;

import java.util.Objects;
import java.util.Optional;

/**
 * 插件前置钩子的执行结果
 * <p>
 * 空结果表示继续执行管线；已写出结果表示响应已经写入，管线必须短路。
 * </p>
 *
 * @author GuardFrame
 */
public final class Result {

    private static final Result PROCEED = new Result(null);

    private final ResponseStatus status;

    private Result(ResponseStatus status) {
        this.status = status;
    }

    /**
     * 继续执行后续插件与业务处理器
     */
    public static Result proceed() {
        return PROCEED;
    }

    /**
     * 响应已以指定状态写出
     */
    public static Result written(ResponseStatus status) {
        return new Result(Objects.requireNonNull(status, "status"));
    }

    public boolean isWritten() {
        return status != null;
    }

    public Optional<ResponseStatus> getStatus() {
        return Optional.ofNullable(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result other)) return false;
        return status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(status);
    }

    @Override
    public String toString() {
        return isWritten() ? "Result(written " + status.getCode() + ")" : "Result(proceed)";
    }
}
