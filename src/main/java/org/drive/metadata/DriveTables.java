package org.drive.metadata;

import org.drive.metadata.store.Table;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * 行存储中的表定义。
 */
public final class DriveTables {

    /**
     * files_folders：未删除节点以 (ownerId, path) 为唯一键；回收站中的节点不参与唯一约束。
     */
    public static final Table<DriveNode> NODES = Table.<DriveNode>of("files_folders", DriveNode::id, DriveNode::withId)
            .withUniqueKey(n -> n.deleted() ? null : List.of(n.ownerId(), n.path()))
            .orderedBy(Comparator.comparing(DriveNode::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));

    /**
     * permissions：以 (nodeId, granteeId) 为唯一键。
     */
    public static final Table<PermissionGrant> GRANTS = Table.<PermissionGrant>of("permissions", PermissionGrant::id, PermissionGrant::withId)
            .withUniqueKey(g -> new PermissionGrant.Key(g.nodeId(), g.granteeId()));

    private DriveTables() {
    }
}
