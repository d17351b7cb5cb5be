package org.drive.metadata;

import org.drive.metadata.dto.GrantListResult;
import org.drive.metadata.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 授权记录管理：授予、修改、撤销、列出。
 * <p>
 * 写入授权前必须重新确认执行者本身在节点上持有 owner 权限，防止 editor 自行提权。
 * 授权变化会失效被授权者的缓存（其“共享给我”列表随之变化）。
 */
public class PermissionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermissionService.class);

    private final NodeRepository repository;
    private final RowStore rowStore;
    private final AccessControlService accessControl;
    private final ListingCache cache;
    private final Clock clock;

    public PermissionService(NodeRepository repository, AccessControlService accessControl, ListingCache cache, Clock clock) {
        this.repository = repository;
        this.rowStore = repository.rowStore();
        this.accessControl = accessControl;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * 授予角色；(node, grantee) 已有记录时更新角色而不是新增。
     *
     * @throws DriveException INVALID_INPUT：缺少被授权者、角色无效或被授权者就是所有者；FORBIDDEN：执行者不是 owner
     */
    public PermissionGrant grant(Principal actor, String nodeId, String granteeId, String roleName) {
        Principal.requireAuthenticated(actor);
        String grantee = requireGrantee(granteeId);
        Role role = Role.parse(roleName);
        DriveNode node = requireOwnedNode(actor, nodeId);
        if (grantee.equals(node.ownerId())) {
            throw DriveException.invalidInput("所有者已隐式持有 owner 权限，无需授权：" + grantee);
        }

        Instant now = clock.instant();
        PermissionGrant result;
        try {
            result = rowStore.insert(DriveTables.GRANTS, new PermissionGrant(null, node.id(), grantee, role, actor.id(), now));
        } catch (DriveException e) {
            if (e.getCode() != ErrorCode.CONFLICT) {
                throw e;
            }
            // 已存在授权：改为更新角色
            List<PermissionGrant> updated = rowStore.updateWhere(DriveTables.GRANTS,
                    g -> node.id().equals(g.nodeId()) && grantee.equals(g.granteeId()),
                    g -> g.withRole(role, actor.id(), now));
            if (updated.isEmpty()) {
                throw new DriveException(ErrorCode.CONFLICT, "授权记录被并发修改，请重试：" + node.id(), e);
            }
            result = updated.get(0);
        }
        cache.invalidate(grantee);
        LOGGER.info("Granted {} on node {} to {} by {}", role.wireName(), node.id(), grantee, actor.id());
        return result;
    }

    /**
     * 修改已有授权的角色。
     *
     * @throws DriveException NOT_FOUND：授权记录不存在
     */
    public PermissionGrant updateGrant(Principal actor, String nodeId, String granteeId, String roleName) {
        Principal.requireAuthenticated(actor);
        String grantee = requireGrantee(granteeId);
        Role role = Role.parse(roleName);
        DriveNode node = requireOwnedNode(actor, nodeId);

        Instant now = clock.instant();
        List<PermissionGrant> updated = rowStore.updateWhere(DriveTables.GRANTS,
                g -> node.id().equals(g.nodeId()) && grantee.equals(g.granteeId()),
                g -> g.withRole(role, actor.id(), now));
        if (updated.isEmpty()) {
            throw DriveException.notFound("授权记录不存在：" + node.id() + " / " + grantee);
        }
        cache.invalidate(grantee);
        LOGGER.info("Updated grant on node {} for {} to {} by {}", node.id(), grantee, role.wireName(), actor.id());
        return updated.get(0);
    }

    /**
     * 撤销授权。
     *
     * @throws DriveException NOT_FOUND：授权记录不存在
     */
    public PermissionGrant revokeGrant(Principal actor, String nodeId, String granteeId) {
        Principal.requireAuthenticated(actor);
        String grantee = requireGrantee(granteeId);
        DriveNode node = requireOwnedNode(actor, nodeId);

        List<PermissionGrant> removed = rowStore.deleteWhere(DriveTables.GRANTS,
                g -> node.id().equals(g.nodeId()) && grantee.equals(g.granteeId()));
        if (removed.isEmpty()) {
            throw DriveException.notFound("授权记录不存在：" + node.id() + " / " + grantee);
        }
        cache.invalidate(grantee);
        LOGGER.info("Revoked grant on node {} for {} by {}", node.id(), grantee, actor.id());
        return removed.get(0);
    }

    /**
     * 列出节点上的授权记录，viewer 及以上可见。
     */
    public GrantListResult listGrants(Principal actor, String nodeId) {
        Principal.requireAuthenticated(actor);
        DriveNode node = requireLiveNode(nodeId);
        accessControl.require(actor, node, Role.VIEWER);
        return new GrantListResult(node.id(), node.ownerId(), repository.grantsForNode(node.id()));
    }

    private DriveNode requireOwnedNode(Principal actor, String nodeId) {
        DriveNode node = requireLiveNode(nodeId);
        accessControl.require(actor, node, Role.OWNER);
        return node;
    }

    private DriveNode requireLiveNode(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw DriveException.invalidInput("nodeId 不能为空");
        }
        return repository.findLive(nodeId)
                .orElseThrow(() -> DriveException.notFound("文件或文件夹不存在：" + nodeId));
    }

    private static String requireGrantee(String granteeId) {
        if (granteeId == null || granteeId.isBlank()) {
            throw DriveException.invalidInput("必须指定被授权的 user_id");
        }
        return granteeId.trim();
    }
}
