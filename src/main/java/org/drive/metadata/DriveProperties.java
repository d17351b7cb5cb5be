package org.drive.metadata;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 云盘元数据服务的业务配置（{@code app.drive.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>列表/搜索缓存的开关、TTL 与容量上限。</li>
 *   <li>分享链接、下载链接的默认/最大有效期。</li>
 *   <li>对象存储实现的选择（内存版或 S3）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.drive")
public class DriveProperties {

    /**
     * 是否启用列表/搜索缓存。
     * <p>
     * 说明：关闭后每次请求都直接查询行存储；开启时所有写操作都会同步失效相关主体的缓存。
     */
    private boolean cacheEnabled = true;

    /**
     * 缓存条目的 TTL（从写入时刻起算，固定不续期）。
     */
    @NotNull
    private Duration cacheTtl = Duration.ofSeconds(300);

    /**
     * 缓存最多保留多少个条目（超出后淘汰最久未访问的条目）。
     */
    @Min(1)
    @Max(10_000_000)
    private int cacheMaxEntries = 10_000;

    /**
     * 搜索默认分页大小。
     */
    @Min(1)
    @Max(10_000)
    private int searchDefaultLimit = 10;

    /**
     * 搜索允许的最大分页大小（上限保护）。
     */
    @Min(1)
    @Max(10_000)
    private int searchMaxLimit = 100;

    /**
     * 分享链接默认有效期（7 天）。
     */
    @NotNull
    private Duration shareLinkDefaultTtl = Duration.ofDays(7);

    /**
     * 分享链接允许的最大有效期。
     */
    @NotNull
    private Duration shareLinkMaxTtl = Duration.ofDays(7);

    /**
     * 下载链接有效期。
     */
    @NotNull
    private Duration downloadLinkTtl = Duration.ofSeconds(60);

    /**
     * 文件夹占位对象的名称。
     */
    @NotBlank
    private String folderMarkerName = ".keep";

    /**
     * 对象存储实现：memory / s3。
     */
    @NotNull
    private ObjectStoreType objectStore = ObjectStoreType.MEMORY;

    /**
     * 内存版对象存储签名 URL 使用的 HMAC 密钥。
     */
    @NotBlank
    private String signingSecret = "local-dev-secret";

    /**
     * 内存版对象存储签名 URL 的前缀。
     */
    @NotBlank
    private String publicBaseUrl = "http://localhost:8080/storage/v1";

    @Valid
    @NotNull
    private S3 s3 = new S3();

    public enum ObjectStoreType {
        MEMORY,
        S3
    }

    /**
     * S3 对象存储配置（{@code app.drive.s3.*}），仅在 {@code object-store=s3} 时使用。
     */
    public static class S3 {

        private String bucket = "files";

        /**
         * 为空时使用 SDK 默认的 region 解析链。
         */
        private String region;

        /**
         * 兼容 S3 协议的服务地址（例如 MinIO）；为空时使用 AWS 默认地址。
         */
        private String endpoint;

        private boolean pathStyleAccess = false;

        /**
         * 单次 API 调用的超时时间（包含重试）。
         */
        @NotNull
        private Duration apiCallTimeout = Duration.ofSeconds(30);

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    public int getSearchDefaultLimit() {
        return searchDefaultLimit;
    }

    public void setSearchDefaultLimit(int searchDefaultLimit) {
        this.searchDefaultLimit = searchDefaultLimit;
    }

    public int getSearchMaxLimit() {
        return searchMaxLimit;
    }

    public void setSearchMaxLimit(int searchMaxLimit) {
        this.searchMaxLimit = searchMaxLimit;
    }

    public Duration getShareLinkDefaultTtl() {
        return shareLinkDefaultTtl;
    }

    public void setShareLinkDefaultTtl(Duration shareLinkDefaultTtl) {
        this.shareLinkDefaultTtl = shareLinkDefaultTtl;
    }

    public Duration getShareLinkMaxTtl() {
        return shareLinkMaxTtl;
    }

    public void setShareLinkMaxTtl(Duration shareLinkMaxTtl) {
        this.shareLinkMaxTtl = shareLinkMaxTtl;
    }

    public Duration getDownloadLinkTtl() {
        return downloadLinkTtl;
    }

    public void setDownloadLinkTtl(Duration downloadLinkTtl) {
        this.downloadLinkTtl = downloadLinkTtl;
    }

    public String getFolderMarkerName() {
        return folderMarkerName;
    }

    public void setFolderMarkerName(String folderMarkerName) {
        this.folderMarkerName = folderMarkerName;
    }

    public ObjectStoreType getObjectStore() {
        return objectStore;
    }

    public void setObjectStore(ObjectStoreType objectStore) {
        this.objectStore = objectStore;
    }

    public String getSigningSecret() {
        return signingSecret;
    }

    public void setSigningSecret(String signingSecret) {
        this.signingSecret = signingSecret;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }
}
