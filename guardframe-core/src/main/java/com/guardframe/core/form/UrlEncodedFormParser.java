package com.guardframe.core.form;

import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * {@code application/x-www-form-urlencoded} 请求体解析
 */
final class UrlEncodedFormParser {

    private UrlEncodedFormParser() {
    }

    /**
     * 返回字段的第一个值
     *
     * @throws IllegalArgumentException 如果遇到非法的百分号编码
     */
    static Optional<String> findFirst(byte[] body, Charset charset, String fieldName) {
        // 编码后的表单只含 ASCII，按 ISO-8859-1 还原不会丢字节
        String form = new String(body, StandardCharsets.ISO_8859_1);
        for (String pair : form.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String rawKey = eq < 0 ? pair : pair.substring(0, eq);
            String rawValue = eq < 0 ? "" : pair.substring(eq + 1);
            if (fieldName.equals(decode(rawKey, charset))) {
                return Optional.of(decode(rawValue, charset));
            }
        }
        return Optional.empty();
    }

    private static String decode(String raw, Charset charset) {
        return URLDecoder.decode(raw, charset);
    }
}
