package org.drive.metadata;

import org.drive.metadata.store.InMemoryObjectStore;
import org.drive.metadata.store.InMemoryRowStore;
import org.drive.metadata.store.ObjectStore;
import org.drive.metadata.store.RowStore;
import org.drive.metadata.store.S3ObjectStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * 云盘元数据核心的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>行存储默认使用内存实现；对象存储按 {@code app.drive.object-store} 选择内存版或 S3。</li>
 *   <li>{@link ListingCache} 在这里创建一次，进程内唯一，通过依赖注入交给各服务。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class DriveConfiguration {

    @Bean
    public Clock driveClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RowStore rowStore() {
        return new InMemoryRowStore();
    }

    @Bean
    public ObjectStore objectStore(DriveProperties properties, Clock driveClock) {
        if (properties.getObjectStore() == DriveProperties.ObjectStoreType.S3) {
            return s3ObjectStore(properties.getS3());
        }
        return new InMemoryObjectStore(
                properties.getPublicBaseUrl(),
                properties.getSigningSecret().getBytes(StandardCharsets.UTF_8),
                driveClock
        );
    }

    @Bean
    public NodeRepository nodeRepository(RowStore rowStore) {
        return new NodeRepository(rowStore);
    }

    @Bean
    public ListingCache listingCache(DriveProperties properties, Clock driveClock) {
        return new ListingCache(properties, driveClock);
    }

    @Bean
    public ObjectReferenceResolver objectReferenceResolver(DriveProperties properties) {
        return new ObjectReferenceResolver(properties.getFolderMarkerName());
    }

    @Bean
    public AccessControlService accessControlService(NodeRepository nodeRepository) {
        return new AccessControlService(nodeRepository);
    }

    @Bean
    public NodeLifecycleService nodeLifecycleService(NodeRepository nodeRepository,
                                                     ObjectStore objectStore,
                                                     AccessControlService accessControlService,
                                                     ObjectReferenceResolver objectReferenceResolver,
                                                     ListingCache listingCache,
                                                     Clock driveClock) {
        return new NodeLifecycleService(nodeRepository, objectStore, accessControlService,
                objectReferenceResolver, listingCache, driveClock);
    }

    @Bean
    public PermissionService permissionService(NodeRepository nodeRepository,
                                               AccessControlService accessControlService,
                                               ListingCache listingCache,
                                               Clock driveClock) {
        return new PermissionService(nodeRepository, accessControlService, listingCache, driveClock);
    }

    @Bean
    public DriveQueryService driveQueryService(NodeRepository nodeRepository,
                                               ListingCache listingCache,
                                               DriveProperties properties) {
        return new DriveQueryService(nodeRepository, listingCache, properties);
    }

    @Bean
    public SharingService sharingService(NodeRepository nodeRepository,
                                         AccessControlService accessControlService,
                                         ObjectReferenceResolver objectReferenceResolver,
                                         ObjectStore objectStore,
                                         DriveProperties properties,
                                         Clock driveClock) {
        return new SharingService(nodeRepository, accessControlService, objectReferenceResolver,
                objectStore, properties, driveClock);
    }

    private static S3ObjectStore s3ObjectStore(DriveProperties.S3 s3) {
        ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
                .apiCallTimeout(s3.getApiCallTimeout())
                .build();
        S3Configuration serviceConfiguration = S3Configuration.builder()
                .pathStyleAccessEnabled(s3.isPathStyleAccess())
                .build();

        S3ClientBuilder clientBuilder = S3Client.builder()
                .overrideConfiguration(overrides)
                .serviceConfiguration(serviceConfiguration);
        S3Presigner.Builder presignerBuilder = S3Presigner.builder()
                .serviceConfiguration(serviceConfiguration);
        if (s3.getRegion() != null && !s3.getRegion().isBlank()) {
            Region region = Region.of(s3.getRegion());
            clientBuilder.region(region);
            presignerBuilder.region(region);
        }
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            URI endpoint = URI.create(s3.getEndpoint());
            clientBuilder.endpointOverride(endpoint);
            presignerBuilder.endpointOverride(endpoint);
        }
        return new S3ObjectStore(clientBuilder.build(), presignerBuilder.build(), s3.getBucket());
    }
}
