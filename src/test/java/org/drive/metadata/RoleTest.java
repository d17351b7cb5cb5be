package org.drive.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.drive.metadata.DriveAssertions.assertFailsWith;

class RoleTest {

    @Test
    void parse_acceptsKnownRolesIgnoringCase() {
        assertThat(Role.parse("owner")).isEqualTo(Role.OWNER);
        assertThat(Role.parse(" Editor ")).isEqualTo(Role.EDITOR);
        assertThat(Role.parse("VIEWER")).isEqualTo(Role.VIEWER);
    }

    @Test
    void parse_rejectsUnknownOrMissingRole() {
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> Role.parse("admin"));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> Role.parse(""));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> Role.parse(null));
    }

    @Test
    void satisfies_followsOwnerEditorViewerOrdering() {
        assertThat(Role.OWNER.satisfies(Role.EDITOR)).isTrue();
        assertThat(Role.EDITOR.satisfies(Role.EDITOR)).isTrue();
        assertThat(Role.EDITOR.satisfies(Role.VIEWER)).isTrue();
        assertThat(Role.EDITOR.satisfies(Role.OWNER)).isFalse();
        assertThat(Role.VIEWER.satisfies(Role.EDITOR)).isFalse();
    }
}
