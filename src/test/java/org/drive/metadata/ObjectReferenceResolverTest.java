package org.drive.metadata;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.drive.metadata.DriveAssertions.assertFailsWith;

class ObjectReferenceResolverTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectReferenceResolver resolver = new ObjectReferenceResolver(".keep");

    @Test
    void resolve_returnsBackingKeyForFiles() {
        DriveNode file = new DriveNode("1", "u", "a.txt", "u/docs/1_a.txt", NodeKind.FILE, "u/docs", false,
                "blob/key", T, T, null);

        assertThat(resolver.resolve(file)).isEqualTo("blob/key");
    }

    @Test
    void resolve_returnsMarkerObjectForFolders() {
        DriveNode folder = new DriveNode("2", "u", "docs", "u/docs", NodeKind.FOLDER, null, false, null, T, T, null);

        assertThat(resolver.resolve(folder)).isEqualTo("u/docs/.keep");
    }

    @Test
    void resolve_fileWithoutBackingKeyIsAnInternalFailure() {
        DriveNode broken = new DriveNode("3", "u", "a.txt", "u/a.txt", NodeKind.FILE, null, false, null, T, T, null);

        assertFailsWith(ErrorCode.INTERNAL, () -> resolver.resolve(broken));
    }

    @Test
    void resolve_missingNodeIsNotFound() {
        assertFailsWith(ErrorCode.NOT_FOUND, () -> resolver.resolve(null));
    }
}
