package com.guardframe.starter.web;

import com.guardframe.core.http.AbstractResponseWriter;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.List;

/**
 * Servlet 响应适配，每个请求一个实例
 */
public class ServletResponseWriter extends AbstractResponseWriter {

    private final HttpServletResponse response;

    public ServletResponseWriter(HttpServletResponse response) {
        super((name, values) -> writeHeader(response, name, values));
        this.response = response;
    }

    @Override
    protected void writeStatus(int code) {
        response.setStatus(code);
    }

    @Override
    protected void writeBody(byte[] body) throws IOException {
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }

    private static void writeHeader(HttpServletResponse response, String name, List<String> values) {
        if (values.isEmpty()) {
            response.setHeader(name, null);
            return;
        }
        response.setHeader(name, values.get(0));
        for (int i = 1; i < values.size(); i++) {
            response.addHeader(name, values.get(i));
        }
    }
}
