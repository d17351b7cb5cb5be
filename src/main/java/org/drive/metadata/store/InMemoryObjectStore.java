package org.drive.metadata.store;

import org.drive.metadata.DriveException;
import org.drive.metadata.SigningUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 对象存储的内存实现（本地开发/测试用）。
 * <p>
 * 签名 URL 形如 {@code <baseUrl>/object/sign/<key>?expires=<epochSecond>&token=<hmac>}，
 * 其中 token 为 {@code HMAC-SHA256(secret, key + "\n" + expires)}，可通过 {@link #verifySignature} 校验。
 * <p>
 * 注意：仅用于单实例/单进程场景；进程重启后对象全部丢失。
 */
public class InMemoryObjectStore implements ObjectStore {

    private final String baseUrl;
    private final byte[] secret;
    private final Clock clock;
    private final ConcurrentHashMap<String, StoredObject> objects = new ConcurrentHashMap<>();

    public InMemoryObjectStore(String baseUrl, byte[] secret, Clock clock) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.secret = secret.clone();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void putObject(String key, byte[] bytes, String contentType) {
        requireKey(key);
        Objects.requireNonNull(bytes, "bytes");
        objects.put(key, new StoredObject(bytes.clone(), contentType, clock.instant()));
    }

    @Override
    public void moveObject(String oldKey, String newKey) {
        requireKey(oldKey);
        requireKey(newKey);
        if (oldKey.equals(newKey)) {
            return;
        }
        StoredObject moved = objects.remove(oldKey);
        if (moved == null) {
            throw DriveException.notFound("对象不存在：" + oldKey);
        }
        objects.put(newKey, moved);
    }

    @Override
    public void deleteObject(String key) {
        requireKey(key);
        objects.remove(key);
    }

    @Override
    public String createSignedUrl(String key, Duration ttl) {
        requireKey(key);
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw DriveException.invalidInput("签名 URL 有效期必须大于 0");
        }
        if (!objects.containsKey(key)) {
            throw DriveException.notFound("对象不存在：" + key);
        }
        long expires = clock.instant().plus(ttl).getEpochSecond();
        String token = SigningUtils.hmacSha256Hex(secret, key + "\n" + expires);
        return baseUrl + "/object/sign/" + URLEncoder.encode(key, StandardCharsets.UTF_8)
                + "?expires=" + expires + "&token=" + token;
    }

    /**
     * 校验签名 URL 的参数：签名正确且尚未过期。
     */
    public boolean verifySignature(String key, long expiresEpochSecond, String token) {
        if (clock.instant().getEpochSecond() > expiresEpochSecond) {
            return false;
        }
        String expected = SigningUtils.hmacSha256Hex(secret, key + "\n" + expiresEpochSecond);
        return SigningUtils.signatureMatches(expected, token);
    }

    public Optional<StoredObject> getObject(String key) {
        return Optional.ofNullable(objects.get(key));
    }

    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw DriveException.invalidInput("对象 key 不能为空");
        }
    }

    private static String stripTrailingSlash(String raw) {
        return raw.replaceAll("/+$", "");
    }

    /**
     * 内存中的对象。
     *
     * @param bytes       对象内容
     * @param contentType MIME 类型
     * @param storedAt    写入时间
     */
    public record StoredObject(byte[] bytes, String contentType, Instant storedAt) {
    }
}
