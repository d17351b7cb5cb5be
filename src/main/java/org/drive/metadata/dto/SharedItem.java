package org.drive.metadata.dto;

import org.drive.metadata.DriveNode;
import org.drive.metadata.Role;

/**
 * 他人共享给我的一个节点。
 *
 * @param node 节点
 * @param role 我在该节点上的角色
 */
public record SharedItem(
        DriveNode node,
        Role role
) {
}
