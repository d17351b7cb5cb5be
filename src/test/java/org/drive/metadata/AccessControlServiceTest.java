package org.drive.metadata;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.drive.metadata.DriveAssertions.assertFailsWith;
import static org.drive.metadata.DriveFixture.user;

class AccessControlServiceTest {

    private final DriveFixture drive = new DriveFixture();
    private final Principal alice = user("alice");
    private final Principal bob = user("bob");

    @Test
    void authorize_ownerIsAlwaysAllowedRegardlessOfGrants() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        for (Role required : Role.values()) {
            assertThat(drive.accessControl.authorize(alice, node, required)).isEqualTo(AccessDecision.ALLOW);
        }
    }

    @Test
    void authorize_deniesWithoutGrant() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        assertThat(drive.accessControl.authorize(bob, node, Role.VIEWER)).isEqualTo(AccessDecision.DENY);
        assertFailsWith(ErrorCode.FORBIDDEN, () -> drive.accessControl.require(bob, node, Role.VIEWER));
    }

    @Test
    void authorize_viewerCannotActAsEditor() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "viewer");

        assertThat(drive.accessControl.authorize(bob, node, Role.VIEWER)).isEqualTo(AccessDecision.ALLOW);
        assertThat(drive.accessControl.authorize(bob, node, Role.EDITOR)).isEqualTo(AccessDecision.DENY);
        assertThat(drive.accessControl.authorize(bob, node, Role.OWNER)).isEqualTo(AccessDecision.DENY);
    }

    @Test
    void authorize_editorGrantCoversViewerButNotOwner() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "editor");

        assertThat(drive.accessControl.effectiveRole(bob, node)).contains(Role.EDITOR);
        assertThat(drive.accessControl.authorize(bob, node, Role.VIEWER).isAllowed()).isTrue();
        assertThat(drive.accessControl.authorize(bob, node, Role.OWNER).isAllowed()).isFalse();
    }

    @Test
    void authorize_deniesMissingPrincipal() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        assertThat(drive.accessControl.authorize(null, node, Role.VIEWER)).isEqualTo(AccessDecision.DENY);
    }
}
