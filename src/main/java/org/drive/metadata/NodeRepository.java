package org.drive.metadata;

import org.drive.metadata.store.PageRequest;
import org.drive.metadata.store.PageSlice;
import org.drive.metadata.store.RowStore;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 面向节点/授权记录的常用查询，封装对 {@link RowStore} 的过滤条件。
 */
public class NodeRepository {

    private final RowStore rowStore;

    public NodeRepository(RowStore rowStore) {
        this.rowStore = rowStore;
    }

    public RowStore rowStore() {
        return rowStore;
    }

    public Optional<DriveNode> findById(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return Optional.empty();
        }
        return rowStore.selectWhere(DriveTables.NODES, n -> nodeId.equals(n.id()))
                .stream()
                .findFirst();
    }

    public Optional<DriveNode> findLive(String nodeId) {
        return findById(nodeId).filter(DriveNode::isLive);
    }

    public Optional<DriveNode> findLiveByPath(String ownerId, String path) {
        return rowStore.selectWhere(DriveTables.NODES,
                        n -> !n.deleted() && ownerId.equals(n.ownerId()) && path.equals(n.path()))
                .stream()
                .findFirst();
    }

    public List<DriveNode> listLive(String ownerId) {
        return rowStore.selectWhere(DriveTables.NODES, n -> !n.deleted() && ownerId.equals(n.ownerId()));
    }

    public List<DriveNode> listTrashed(String ownerId) {
        return rowStore.selectWhere(DriveTables.NODES, n -> n.deleted() && ownerId.equals(n.ownerId()));
    }

    public List<DriveNode> listLiveByIds(Set<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return List.of();
        }
        return rowStore.selectWhere(DriveTables.NODES, n -> !n.deleted() && nodeIds.contains(n.id()));
    }

    /**
     * 名称或路径包含关键字（不区分大小写）的未删除节点。
     */
    public PageSlice<DriveNode> searchLive(String ownerId, String query, PageRequest page) {
        String needle = query.toLowerCase(Locale.ROOT);
        return rowStore.selectWhere(DriveTables.NODES,
                n -> !n.deleted()
                        && ownerId.equals(n.ownerId())
                        && (n.name().toLowerCase(Locale.ROOT).contains(needle)
                        || n.path().toLowerCase(Locale.ROOT).contains(needle)),
                page);
    }

    public Optional<PermissionGrant> findGrant(String nodeId, String granteeId) {
        return rowStore.selectWhere(DriveTables.GRANTS,
                        g -> nodeId.equals(g.nodeId()) && granteeId.equals(g.granteeId()))
                .stream()
                .findFirst();
    }

    public List<PermissionGrant> grantsForNode(String nodeId) {
        return rowStore.selectWhere(DriveTables.GRANTS, g -> nodeId.equals(g.nodeId()));
    }

    public List<PermissionGrant> grantsForGrantee(String granteeId) {
        return rowStore.selectWhere(DriveTables.GRANTS, g -> granteeId.equals(g.granteeId()));
    }
}
