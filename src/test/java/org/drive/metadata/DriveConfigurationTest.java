package org.drive.metadata;

import org.drive.metadata.store.InMemoryObjectStore;
import org.drive.metadata.store.ObjectStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DriveConfigurationTest {

    @Test
    void properties_bindRelaxedNamesAndDurations() {
        Map<String, String> source = Map.of(
                "app.drive.cache-ttl", "120s",
                "app.drive.share-link-default-ttl", "1d",
                "app.drive.search-max-limit", "50",
                "app.drive.object-store", "s3",
                "app.drive.s3.bucket", "drive-files",
                "app.drive.s3.path-style-access", "true"
        );

        DriveProperties properties = new Binder(new MapConfigurationPropertySource(source))
                .bind("app.drive", DriveProperties.class)
                .get();

        assertThat(properties.getCacheTtl()).isEqualTo(Duration.ofSeconds(120));
        assertThat(properties.getShareLinkDefaultTtl()).isEqualTo(Duration.ofDays(1));
        assertThat(properties.getShareLinkMaxTtl()).isEqualTo(Duration.ofDays(7));
        assertThat(properties.getSearchMaxLimit()).isEqualTo(50);
        assertThat(properties.getSearchDefaultLimit()).isEqualTo(10);
        assertThat(properties.getObjectStore()).isEqualTo(DriveProperties.ObjectStoreType.S3);
        assertThat(properties.getS3().getBucket()).isEqualTo("drive-files");
        assertThat(properties.getS3().isPathStyleAccess()).isTrue();
    }

    @Test
    void objectStore_defaultsToInMemory() {
        DriveConfiguration configuration = new DriveConfiguration();

        ObjectStore store = configuration.objectStore(new DriveProperties(), Clock.systemUTC());

        assertThat(store).isInstanceOf(InMemoryObjectStore.class);
    }
}
