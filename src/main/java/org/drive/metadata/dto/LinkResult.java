package org.drive.metadata.dto;

import java.time.Instant;

/**
 * 分享/下载链接。
 *
 * @param nodeId     节点 id
 * @param objectKey  链接指向的对象 key（文件夹为占位对象）
 * @param url        签名 URL
 * @param ttlSeconds 有效期（秒）
 * @param expiresAt  过期时间
 */
public record LinkResult(
        String nodeId,
        String objectKey,
        String url,
        long ttlSeconds,
        Instant expiresAt
) {
}
