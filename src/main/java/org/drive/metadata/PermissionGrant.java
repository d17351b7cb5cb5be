package org.drive.metadata;

import java.time.Instant;
import java.util.Objects;

/**
 * 对某个节点的显式授权记录。每个 (nodeId, granteeId) 最多一条；节点所有者隐式持有 owner，无需记录。
 *
 * @param id        存储分配的标识
 * @param nodeId    节点 id
 * @param granteeId 被授权主体
 * @param role      角色
 * @param grantedBy 执行授权的主体
 * @param updatedAt 最后一次写入时间
 */
public record PermissionGrant(
        String id,
        String nodeId,
        String granteeId,
        Role role,
        String grantedBy,
        Instant updatedAt
) {

    public PermissionGrant {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(granteeId, "granteeId");
        Objects.requireNonNull(role, "role");
    }

    public PermissionGrant withId(String newId) {
        return new PermissionGrant(newId, nodeId, granteeId, role, grantedBy, updatedAt);
    }

    public PermissionGrant withRole(Role newRole, String actorId, Instant now) {
        return new PermissionGrant(id, nodeId, granteeId, newRole, actorId, now);
    }

    /**
     * 唯一键：(nodeId, granteeId)。
     */
    public record Key(String nodeId, String granteeId) {
    }
}
