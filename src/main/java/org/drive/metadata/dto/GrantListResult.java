package org.drive.metadata.dto;

import org.drive.metadata.PermissionGrant;

import java.util.List;

/**
 * 节点上的显式授权列表（不含所有者本人）。
 *
 * @param nodeId  节点 id
 * @param ownerId 节点所有者
 * @param grants  授权记录
 */
public record GrantListResult(
        String nodeId,
        String ownerId,
        List<PermissionGrant> grants
) {
    public GrantListResult {
        grants = List.copyOf(grants);
    }
}
