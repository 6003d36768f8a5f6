package com.guardframe.core.xsrf;

import com.guardframe.api.exception.IdentityLookupException;
import com.guardframe.api.security.UserIdStorage;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;

/**
 * XSRF 令牌生成器
 * <p>
 * 令牌 = base64url(HMAC-SHA256(secret, host ‖ path ‖ userId))，各字段带 4 字节长度前缀，
 * 避免 ("a", "bc") 与 ("ab", "c") 拼接后相同。相同输入恒得到相同令牌。
 * </p>
 * 无共享可变状态，可并发调用。
 */
public class XsrfTokenGenerator {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final UserIdStorage userIdStorage;

    public XsrfTokenGenerator(String secret, UserIdStorage userIdStorage) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.userIdStorage = Objects.requireNonNull(userIdStorage, "userIdStorage");
    }

    /**
     * 为当前用户生成绑定 (host, path) 的令牌
     *
     * @throws IdentityLookupException 如果无法解析当前用户
     */
    public String generate(String host, String path) {
        return token(host, path, resolveUserId());
    }

    /**
     * 通过宿主能力解析当前用户，只尝试一次
     *
     * @throws IdentityLookupException 如果查询失败或返回 null
     */
    public String resolveUserId() {
        String userId;
        try {
            userId = userIdStorage.getUserId();
        } catch (IdentityLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IdentityLookupException("User id lookup failed", e);
        }
        if (userId == null) {
            throw new IdentityLookupException("User id lookup returned null");
        }
        return userId;
    }

    /**
     * 纯函数：计算 (host, path, userId) 对应的令牌
     */
    public String token(String host, String path, String userId) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(userId, "userId");

        Mac mac = newMac();
        update(mac, host);
        update(mac, path);
        update(mac, userId);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(mac.doFinal());
    }

    /**
     * 常量时间比较，耗时与不匹配位置无关
     */
    public static boolean matches(String presented, String expected) {
        if (presented == null || expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private Mac newMac() {
        try {
            // Mac 非线程安全，每次调用新建
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    private static void update(Mac mac, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        mac.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        mac.update(bytes);
    }
}
