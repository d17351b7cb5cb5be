package org.drive.metadata.store;

import org.drive.metadata.DriveException;
import org.drive.metadata.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 基于 AWS S3（或兼容 S3 协议的服务）的对象存储实现。
 * <p>
 * 说明：
 * <ul>
 *   <li>S3 没有原生 move，这里用“服务端 copy + delete”实现；copy 失败时不会删除源对象。</li>
 *   <li>签名 URL 由 {@link S3Presigner} 在本地计算，不产生网络请求。</li>
 *   <li>SDK 异常在此处统一转换为 {@link DriveException}，上层不感知 SDK 类型。</li>
 * </ul>
 */
public class S3ObjectStore implements ObjectStore, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client, S3Presigner presigner, String bucket) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
        this.presigner = Objects.requireNonNull(presigner, "presigner");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    @Override
    public void putObject(String key, byte[] bytes, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();
        call("putObject " + key, () -> s3Client.putObject(request, RequestBody.fromBytes(bytes)));
        LOGGER.debug("Uploaded s3://{}/{} ({} bytes)", bucket, key, bytes.length);
    }

    @Override
    public void moveObject(String oldKey, String newKey) {
        if (oldKey.equals(newKey)) {
            return;
        }
        CopyObjectRequest copy = CopyObjectRequest.builder()
                .sourceBucket(bucket)
                .sourceKey(oldKey)
                .destinationBucket(bucket)
                .destinationKey(newKey)
                .build();
        call("copyObject " + oldKey + " -> " + newKey, () -> s3Client.copyObject(copy));
        deleteObject(oldKey);
        LOGGER.debug("Moved s3://{}/{} to {}", bucket, oldKey, newKey);
    }

    @Override
    public void deleteObject(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        call("deleteObject " + key, () -> s3Client.deleteObject(request));
    }

    @Override
    public String createSignedUrl(String key, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw DriveException.invalidInput("签名 URL 有效期必须大于 0");
        }
        GetObjectRequest getObject = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(getObject)
                .build();
        return call("presignGetObject " + key, () -> presigner.presignGetObject(presignRequest).url().toString());
    }

    @Override
    public void close() {
        try {
            presigner.close();
        } finally {
            s3Client.close();
        }
    }

    private static <R> R call(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw translate(operation, e);
        }
    }

    static DriveException translate(String operation, SdkException e) {
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return new DriveException(ErrorCode.TIMEOUT, "对象存储调用超时：" + operation, e);
        }
        if (e instanceof SdkServiceException service) {
            if (service.statusCode() == 404) {
                return new DriveException(ErrorCode.NOT_FOUND, "对象不存在：" + operation, e);
            }
            if (service.isThrottlingException() || service.statusCode() >= 500) {
                return new DriveException(ErrorCode.UNAVAILABLE, "对象存储暂不可用：" + operation, e);
            }
            return new DriveException(ErrorCode.INTERNAL, "对象存储拒绝请求：" + operation, e);
        }
        return new DriveException(ErrorCode.UNAVAILABLE, "对象存储调用失败：" + operation, e);
    }
}
