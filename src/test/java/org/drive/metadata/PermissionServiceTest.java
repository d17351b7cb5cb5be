package org.drive.metadata;

import org.drive.metadata.dto.GrantListResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.drive.metadata.DriveAssertions.assertFailsWith;
import static org.drive.metadata.DriveFixture.user;

class PermissionServiceTest {

    private final DriveFixture drive = new DriveFixture();
    private final Principal alice = user("alice");
    private final Principal bob = user("bob");
    private final Principal carol = user("carol");

    @Test
    void grant_createsGrantRecord() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        PermissionGrant grant = drive.permissions.grant(alice, node.id(), bob.id(), "Editor");

        assertThat(grant.id()).isNotBlank();
        assertThat(grant.nodeId()).isEqualTo(node.id());
        assertThat(grant.granteeId()).isEqualTo("bob");
        assertThat(grant.role()).isEqualTo(Role.EDITOR);
        assertThat(grant.grantedBy()).isEqualTo("alice");
        assertThat(drive.repository.findGrant(node.id(), bob.id())).contains(grant);
    }

    @Test
    void grant_secondGrantUpdatesRoleInsteadOfDuplicating() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        PermissionGrant first = drive.permissions.grant(alice, node.id(), bob.id(), "viewer");
        drive.clock.advance(Duration.ofMinutes(1));

        PermissionGrant second = drive.permissions.grant(alice, node.id(), bob.id(), "editor");

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(second.role()).isEqualTo(Role.EDITOR);
        assertThat(second.updatedAt()).isEqualTo(drive.clock.instant());
        assertThat(drive.repository.grantsForNode(node.id())).hasSize(1);
    }

    @Test
    void grant_rejectsUnknownRoleAndMissingGrantee() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.permissions.grant(alice, node.id(), bob.id(), "admin"));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.permissions.grant(alice, node.id(), bob.id(), null));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.permissions.grant(alice, node.id(), " ", "viewer"));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.permissions.grant(alice, node.id(), alice.id(), "viewer"));
        assertThat(drive.repository.grantsForNode(node.id())).isEmpty();
    }

    @Test
    void grant_requiresOwnerRole() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "editor");

        // editor 不能给自己或他人提权
        assertFailsWith(ErrorCode.FORBIDDEN, () -> drive.permissions.grant(bob, node.id(), bob.id(), "owner"));
        assertFailsWith(ErrorCode.FORBIDDEN, () -> drive.permissions.grant(bob, node.id(), carol.id(), "viewer"));
        assertFailsWith(ErrorCode.FORBIDDEN, () -> drive.permissions.grant(carol, node.id(), carol.id(), "viewer"));
        assertThat(drive.repository.findGrant(node.id(), bob.id()))
                .hasValueSatisfying(g -> assertThat(g.role()).isEqualTo(Role.EDITOR));
    }

    @Test
    void grant_ownerRoleHolderMayShareFurther() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "owner");

        PermissionGrant grant = drive.permissions.grant(bob, node.id(), carol.id(), "viewer");

        assertThat(grant.grantedBy()).isEqualTo("bob");
        assertThat(drive.accessControl.authorize(carol, node, Role.VIEWER).isAllowed()).isTrue();
    }

    @Test
    void grant_onTrashedOrMissingNodeIsNotFound() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.lifecycle.softDelete(alice, node.id());

        assertFailsWith(ErrorCode.NOT_FOUND, () -> drive.permissions.grant(alice, node.id(), bob.id(), "viewer"));
        assertFailsWith(ErrorCode.NOT_FOUND, () -> drive.permissions.grant(alice, "missing", bob.id(), "viewer"));
    }

    @Test
    void updateGrant_requiresExistingGrant() {
        DriveNode node = drive.upload(alice, null, "a.txt");

        assertFailsWith(ErrorCode.NOT_FOUND, () -> drive.permissions.updateGrant(alice, node.id(), bob.id(), "editor"));

        drive.permissions.grant(alice, node.id(), bob.id(), "viewer");
        PermissionGrant updated = drive.permissions.updateGrant(alice, node.id(), bob.id(), "editor");
        assertThat(updated.role()).isEqualTo(Role.EDITOR);
    }

    @Test
    void revokeGrant_removesAccess() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "editor");

        PermissionGrant revoked = drive.permissions.revokeGrant(alice, node.id(), bob.id());

        assertThat(revoked.granteeId()).isEqualTo("bob");
        assertThat(drive.accessControl.authorize(bob, node, Role.VIEWER).isAllowed()).isFalse();
        assertFailsWith(ErrorCode.NOT_FOUND, () -> drive.permissions.revokeGrant(alice, node.id(), bob.id()));
    }

    @Test
    void listGrants_visibleToViewersButNotStrangers() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "viewer");
        drive.permissions.grant(alice, node.id(), carol.id(), "editor");

        GrantListResult result = drive.permissions.listGrants(bob, node.id());

        assertThat(result.ownerId()).isEqualTo("alice");
        assertThat(result.grants()).extracting(PermissionGrant::granteeId).containsExactlyInAnyOrder("bob", "carol");
        assertFailsWith(ErrorCode.FORBIDDEN, () -> drive.permissions.listGrants(user("mallory"), node.id()));
    }
}
