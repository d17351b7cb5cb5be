package org.drive.metadata.store;

import java.time.Duration;

/**
 * 对象存储（blob）契约：文件字节真正存放的地方。
 * <p>
 * 实现需要把底层异常转换为 {@link org.drive.metadata.DriveException}：
 * 对象不存在为 {@code NOT_FOUND}，超时为 {@code TIMEOUT}，其他故障为 {@code UNAVAILABLE}。
 */
public interface ObjectStore {

    void putObject(String key, byte[] bytes, String contentType);

    void moveObject(String oldKey, String newKey);

    /**
     * 删除对象；对象不存在时视为成功。
     */
    void deleteObject(String key);

    /**
     * 为对象生成带过期时间的签名 URL。
     */
    String createSignedUrl(String key, Duration ttl);
}
