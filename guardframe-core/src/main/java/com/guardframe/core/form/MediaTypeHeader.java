package com.guardframe.core.form;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 解析后的 {@code type/subtype; key=value} 形式头部值，
 * 同时用于 Content-Type 与 Content-Disposition。
 */
final class MediaTypeHeader {

    private final String value;
    private final Map<String, String> parameters;

    private MediaTypeHeader(String value, Map<String, String> parameters) {
        this.value = value;
        this.parameters = parameters;
    }

    /**
     * @return 解析结果；头部为空或格式错误时返回 null
     */
    static MediaTypeHeader parse(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        int semicolon = header.indexOf(';');
        String value = (semicolon < 0 ? header : header.substring(0, semicolon)).trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return null;
        }
        Map<String, String> params = new LinkedHashMap<>();
        int pos = semicolon < 0 ? header.length() : semicolon + 1;
        while (pos < header.length()) {
            int eq = header.indexOf('=', pos);
            if (eq < 0) {
                // 允许结尾多余的分号
                if (header.substring(pos).isBlank()) break;
                return null;
            }
            String key = header.substring(pos, eq).trim().toLowerCase(Locale.ROOT);
            if (key.isEmpty()) {
                return null;
            }
            int i = eq + 1;
            while (i < header.length() && header.charAt(i) == ' ') i++;
            StringBuilder val = new StringBuilder();
            if (i < header.length() && header.charAt(i) == '"') {
                i++;
                boolean closed = false;
                while (i < header.length()) {
                    char c = header.charAt(i++);
                    if (c == '\\' && i < header.length()) {
                        val.append(header.charAt(i++));
                    } else if (c == '"') {
                        closed = true;
                        break;
                    } else {
                        val.append(c);
                    }
                }
                if (!closed) {
                    return null;
                }
                while (i < header.length() && header.charAt(i) != ';') {
                    if (header.charAt(i) != ' ') return null;
                    i++;
                }
            } else {
                int end = header.indexOf(';', i);
                if (end < 0) end = header.length();
                val.append(header, i, end);
                i = end;
            }
            params.put(key, val.toString().trim());
            pos = i + 1;
        }
        return new MediaTypeHeader(value, Collections.unmodifiableMap(params));
    }

    String getValue() {
        return value;
    }

    String getParameter(String name) {
        return parameters.get(name.toLowerCase(Locale.ROOT));
    }
}
