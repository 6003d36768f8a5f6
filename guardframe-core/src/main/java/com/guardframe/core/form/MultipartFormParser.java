package com.guardframe.core.form;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Optional;

/**
 * {@code multipart/form-data} 请求体解析 (RFC 7578 / RFC 2046)
 * <p>
 * 只查找普通表单字段：带 {@code filename} 参数的文件分段会被跳过。
 * 分界符缺失、分段头未结束、请求体被截断均视为格式错误，返回空。
 * </p>
 */
final class MultipartFormParser {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    // RFC 2046: 分界符 1~70 个字符
    private static final int MAX_BOUNDARY_LENGTH = 70;

    private MultipartFormParser() {
    }

    static boolean isValidBoundary(String boundary) {
        return boundary != null && !boundary.isEmpty() && boundary.length() <= MAX_BOUNDARY_LENGTH
                && !boundary.endsWith(" ");
    }

    static Optional<String> findFirst(byte[] body, String boundary, String fieldName) {
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        byte[] innerDelimiter = concat(CRLF, delimiter);

        // 第一个分界符可能位于请求体开头（没有前导 CRLF），之前的内容是 preamble
        int pos = indexOf(body, delimiter, 0);
        if (pos < 0) {
            return Optional.empty();
        }
        while (true) {
            pos += delimiter.length;
            if (startsWith(body, pos, new byte[]{'-', '-'})) {
                // 结束分界符
                return Optional.empty();
            }
            pos = skipLinearWhitespace(body, pos);
            if (!startsWith(body, pos, CRLF)) {
                return Optional.empty();
            }
            pos += CRLF.length;

            int headerEnd;
            String headers;
            if (startsWith(body, pos, CRLF)) {
                // 没有任何分段头
                headerEnd = pos - CRLF.length;
                headers = "";
            } else {
                headerEnd = indexOf(body, HEADER_END, pos);
                if (headerEnd < 0) {
                    return Optional.empty();
                }
                headers = new String(body, pos, headerEnd - pos, StandardCharsets.UTF_8);
            }
            int contentStart = headerEnd + HEADER_END.length;
            int next = indexOf(body, innerDelimiter, contentStart);
            if (next < 0) {
                return Optional.empty();
            }

            PartHeaders part = PartHeaders.parse(headers);
            if (part != null && part.isFormField() && fieldName.equals(part.name)) {
                return Optional.of(new String(body, contentStart, next - contentStart, part.charset));
            }
            pos = next + CRLF.length;
        }
    }

    private static int skipLinearWhitespace(byte[] body, int pos) {
        while (pos < body.length && (body[pos] == ' ' || body[pos] == '\t')) {
            pos++;
        }
        return pos;
    }

    private static boolean startsWith(byte[] body, int offset, byte[] prefix) {
        if (offset < 0 || offset + prefix.length > body.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (body[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    static int indexOf(byte[] body, byte[] pattern, int from) {
        outer:
        for (int i = Math.max(from, 0); i <= body.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (body[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /**
     * 单个分段的头部信息
     */
    private static final class PartHeaders {
        private String name;
        private boolean file;
        private Charset charset = StandardCharsets.UTF_8;

        static PartHeaders parse(String headers) {
            PartHeaders part = new PartHeaders();
            boolean disposition = false;
            for (String line : headers.split("\r\n")) {
                int colon = line.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                String value = line.substring(colon + 1).trim();
                if ("content-disposition".equals(key)) {
                    MediaTypeHeader cd = MediaTypeHeader.parse(value);
                    if (cd == null || !"form-data".equals(cd.getValue())) {
                        return null;
                    }
                    disposition = true;
                    part.name = cd.getParameter("name");
                    part.file = cd.getParameter("filename") != null;
                } else if ("content-type".equals(key)) {
                    MediaTypeHeader ct = MediaTypeHeader.parse(value);
                    String cs = ct == null ? null : ct.getParameter("charset");
                    if (cs != null) {
                        part.charset = toCharset(cs);
                        if (part.charset == null) {
                            return null;
                        }
                    }
                }
            }
            return disposition ? part : null;
        }

        boolean isFormField() {
            return name != null && !file;
        }

        private static Charset toCharset(String name) {
            try {
                return Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                return null;
            }
        }
    }
}
