package org.drive.metadata;

import org.drive.metadata.dto.SearchResult;
import org.drive.metadata.dto.SharedItem;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.drive.metadata.DriveAssertions.assertFailsWith;
import static org.drive.metadata.DriveFixture.user;

class DriveQueryServiceTest {

    private final DriveFixture drive = new DriveFixture();
    private final Principal alice = user("alice");
    private final Principal bob = user("bob");

    @Test
    void listItems_neverServesStaleListingAfterMutation() {
        assertThat(drive.queries.listItems(alice).items()).isEmpty();

        DriveNode node = drive.upload(alice, null, "a.txt");
        assertThat(drive.queries.listItems(alice).items()).extracting(DriveNode::name).containsExactly("a.txt");

        drive.lifecycle.rename(alice, node.id(), "b.txt");
        assertThat(drive.queries.listItems(alice).items()).extracting(DriveNode::name).containsExactly("b.txt");

        drive.lifecycle.softDelete(alice, node.id());
        assertThat(drive.queries.listItems(alice).items()).isEmpty();

        drive.lifecycle.restore(alice, node.id());
        assertThat(drive.queries.listItems(alice).total()).isEqualTo(1);
    }

    @Test
    void listItems_isServedFromCacheUntilTtl() {
        drive.upload(alice, null, "a.txt");
        drive.queries.listItems(alice);
        // 绕过服务直接改行存储：缓存命中期间看不到
        drive.rowStore.deleteWhere(DriveTables.NODES, n -> true);

        assertThat(drive.queries.listItems(alice).items()).hasSize(1);

        drive.clock.advance(Duration.ofSeconds(300));
        assertThat(drive.queries.listItems(alice).items()).isEmpty();
    }

    @Test
    void listItems_onlyContainsOwnLiveNodes() {
        DriveNode mine = drive.upload(alice, null, "mine.txt");
        DriveNode trashed = drive.upload(alice, null, "old.txt");
        drive.lifecycle.softDelete(alice, trashed.id());
        DriveNode theirs = drive.upload(bob, null, "theirs.txt");
        drive.permissions.grant(bob, theirs.id(), alice.id(), "editor");

        assertThat(drive.queries.listItems(alice).items()).extracting(DriveNode::id).containsExactly(mine.id());
    }

    @Test
    void search_paginatesWithTotalPages() {
        for (int i = 1; i <= 25; i++) {
            drive.upload(alice, null, String.format("report-%02d.txt", i));
            drive.clock.advance(Duration.ofMillis(1));
        }
        drive.upload(alice, null, "notes.txt");

        SearchResult first = drive.queries.search(alice, "report", null, null);
        assertThat(first.total()).isEqualTo(25);
        assertThat(first.page()).isEqualTo(1);
        assertThat(first.limit()).isEqualTo(10);
        assertThat(first.totalPages()).isEqualTo(3);
        assertThat(first.items()).hasSize(10);

        SearchResult last = drive.queries.search(alice, "report", 3, 10);
        assertThat(last.items())
                .extracting(DriveNode::name)
                .containsExactly("report-21.txt", "report-22.txt", "report-23.txt", "report-24.txt", "report-25.txt");

        assertThat(drive.queries.search(alice, "report", 4, 10).items()).isEmpty();
    }

    @Test
    void search_matchesNameOrPathCaseInsensitively() {
        drive.lifecycle.createFolder(alice, null, "Projects");
        drive.upload(alice, "alice/Projects", "plan.md");
        drive.upload(alice, null, "unrelated.txt");

        assertThat(drive.queries.search(alice, "PROJECTS", 1, 10).items())
                .extracting(DriveNode::path)
                .containsExactly("alice/Projects", "alice/Projects/1700000000000_plan.md");
        assertThat(drive.queries.search(alice, "Plan", 1, 10).total()).isEqualTo(1);
    }

    @Test
    void search_excludesTrashedAndForeignNodes() {
        DriveNode trashed = drive.upload(alice, null, "report.txt");
        drive.lifecycle.softDelete(alice, trashed.id());
        drive.upload(bob, null, "report.txt");

        SearchResult result = drive.queries.search(alice, "report", 1, 10);

        assertThat(result.total()).isZero();
        assertThat(result.totalPages()).isZero();
    }

    @Test
    void search_rejectsInvalidArguments() {
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.queries.search(alice, " ", 1, 10));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.queries.search(alice, null, 1, 10));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.queries.search(alice, "a", 0, 10));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.queries.search(alice, "a", 1, 0));
        assertFailsWith(ErrorCode.INVALID_INPUT, () -> drive.queries.search(alice, "a", 1, 101));
        assertFailsWith(ErrorCode.UNAUTHORIZED, () -> drive.queries.search(null, "a", 1, 10));
    }

    @Test
    void search_cachedResultIsInvalidatedByRename() {
        DriveNode node = drive.upload(alice, null, "draft.txt");
        assertThat(drive.queries.search(alice, "draft", 1, 10).total()).isEqualTo(1);

        drive.lifecycle.rename(alice, node.id(), "final.txt");

        assertThat(drive.queries.search(alice, "draft", 1, 10).total()).isZero();
        assertThat(drive.queries.search(alice, "final", 1, 10).total()).isEqualTo(1);
    }

    @Test
    void listSharedWithMe_reportsRoleAndFollowsOwnerChanges() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        drive.permissions.grant(alice, node.id(), bob.id(), "editor");

        SharedItem item = drive.queries.listSharedWithMe(bob).items().get(0);
        assertThat(item.role()).isEqualTo(Role.EDITOR);
        assertThat(item.node().name()).isEqualTo("a.txt");

        drive.lifecycle.rename(alice, node.id(), "b.txt");
        assertThat(drive.queries.listSharedWithMe(bob).items())
                .extracting(shared -> shared.node().name())
                .containsExactly("b.txt");

        drive.permissions.updateGrant(alice, node.id(), bob.id(), "viewer");
        assertThat(drive.queries.listSharedWithMe(bob).items())
                .extracting(SharedItem::role)
                .containsExactly(Role.VIEWER);

        drive.permissions.revokeGrant(alice, node.id(), bob.id());
        assertThat(drive.queries.listSharedWithMe(bob).items()).isEmpty();
    }

    @Test
    void listTrash_isNotCached() {
        DriveNode node = drive.upload(alice, null, "a.txt");
        assertThat(drive.queries.listTrash(alice).items()).isEmpty();

        drive.rowStore.updateWhere(DriveTables.NODES, n -> node.id().equals(n.id()), n -> n.withDeleted(true, drive.clock.instant()));

        assertThat(drive.queries.listTrash(alice).items()).extracting(DriveNode::id).containsExactly(node.id());
        assertThat(drive.queries.listTrash(bob).items()).isEmpty();
    }
}
