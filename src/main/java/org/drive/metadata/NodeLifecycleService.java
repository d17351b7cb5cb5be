package org.drive.metadata;

import org.drive.metadata.store.ObjectStore;
import org.drive.metadata.store.RowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 节点生命周期：创建、移入回收站、恢复、改名/移动、彻底删除。
 * <p>
 * 状态机（两个相互独立的维度）：
 * <ul>
 *   <li>存在性：{@code live -> trashed -> live}（恢复）或 {@code live -> trashed -> purged}。</li>
 *   <li>身份：改名/移动只允许在 live 状态下进行。</li>
 * </ul>
 * <p>
 * 并发策略：
 * <ul>
 *   <li>每次状态迁移都是带前置条件的条件更新（例如 {@code id=? AND deleted=false}），两个互相冲突的并发操作只有一个能成功。</li>
 *   <li>路径唯一性由行存储的唯一键保证（未删除节点的 (ownerId, path)），查重与写入是同一个原子操作。</li>
 *   <li>任何成功的写操作都会在返回前同步失效所有者及被授权者的列表缓存。</li>
 * </ul>
 * <p>
 * 已知限制：
 * <ul>
 *   <li>移入回收站不级联到子节点；文件夹改名/移动也不会改写子节点路径（路径是唯一的结构关联）。</li>
 *   <li>恢复时如果原路径已被新节点占用，直接以 CONFLICT 拒绝，不自动改名。</li>
 * </ul>
 */
public class NodeLifecycleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeLifecycleService.class);

    private static final String FOLDER_MARKER_CONTENT_TYPE = "application/x-directory";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final NodeRepository repository;
    private final RowStore rowStore;
    private final ObjectStore objectStore;
    private final AccessControlService accessControl;
    private final ObjectReferenceResolver resolver;
    private final ListingCache cache;
    private final Clock clock;

    public NodeLifecycleService(NodeRepository repository,
                                ObjectStore objectStore,
                                AccessControlService accessControl,
                                ObjectReferenceResolver resolver,
                                ListingCache cache,
                                Clock clock) {
        this.repository = repository;
        this.rowStore = repository.rowStore();
        this.objectStore = objectStore;
        this.accessControl = accessControl;
        this.resolver = resolver;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * 写入一条节点记录（只写元数据，不写对象存储）。
     * <p>
     * 文件的 segment 带上传时间前缀；文件未指定 backingKey 时使用其路径。
     *
     * @throws DriveException CONFLICT：同一 owner 下已存在相同路径的未删除节点
     */
    public DriveNode create(Principal owner, String name, String parentPath, NodeKind kind, String backingKey) {
        Principal.requireAuthenticated(owner);
        if (kind == null) {
            throw DriveException.invalidInput("kind 不能为空（file/folder）");
        }
        String validName = NodePaths.requireValidName(name, "name");
        String parent = NodePaths.normalizeParent(parentPath);
        requireParentFolder(owner.id(), parent);

        String segment = (kind == NodeKind.FOLDER) ? validName : NodePaths.fileSegment(clock.millis(), validName);
        String path = NodePaths.child(owner.id(), parent, segment);
        String key = null;
        if (kind == NodeKind.FILE) {
            key = (backingKey == null || backingKey.isBlank()) ? path : backingKey;
        }
        Instant now = clock.instant();
        DriveNode draft = new DriveNode(null, owner.id(), validName, path, kind, parent, false, key, now, now, null);
        DriveNode created;
        try {
            created = rowStore.insert(DriveTables.NODES, draft);
        } catch (DriveException e) {
            if (e.getCode() == ErrorCode.CONFLICT) {
                throw new DriveException(ErrorCode.CONFLICT, "路径已存在：" + path, e);
            }
            throw e;
        }
        invalidateAffected(created);
        return created;
    }

    /**
     * 新建文件夹：先写元数据（占住路径），再写 {@code .keep} 占位对象；占位对象写入失败则回滚元数据。
     * <p>
     * 回滚后再失效一次缓存，避免期间读到的“幽灵”节点留在缓存里。
     */
    public DriveNode createFolder(Principal principal, String parentPath, String name) {
        DriveNode folder = create(principal, name, parentPath, NodeKind.FOLDER, null);
        try {
            objectStore.putObject(resolver.markerKey(folder.path()), new byte[0], FOLDER_MARKER_CONTENT_TYPE);
        } catch (DriveException e) {
            rollbackInsert(folder, e);
            invalidateAffected(folder);
            throw e;
        }
        LOGGER.info("Created folder {} ({}) for {}", folder.path(), folder.id(), principal.id());
        return folder;
    }

    /**
     * 上传文件：先写元数据（占住路径），再写对象；对象写入失败则回滚元数据。
     */
    public DriveNode uploadFile(Principal principal, String parentPath, String originalName, byte[] bytes, String contentType) {
        Principal.requireAuthenticated(principal);
        if (bytes == null) {
            throw DriveException.invalidInput("没有上传文件内容");
        }
        DriveNode file = create(principal, originalName, parentPath, NodeKind.FILE, null);
        String type = (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType;
        try {
            objectStore.putObject(file.backingKey(), bytes, type);
        } catch (DriveException e) {
            rollbackInsert(file, e);
            invalidateAffected(file);
            throw e;
        }
        LOGGER.info("Uploaded file {} ({}, {} bytes) for {}", file.path(), file.id(), bytes.length, principal.id());
        return file;
    }

    /**
     * 移入回收站：只有所有者可以操作，其他主体（包括被授权者）一律视为不存在。
     *
     * @throws DriveException NOT_FOUND：不存在属于调用者的未删除节点
     */
    public DriveNode softDelete(Principal actor, String nodeId) {
        Principal.requireAuthenticated(actor);
        requireNodeId(nodeId);
        Instant now = clock.instant();
        List<DriveNode> updated = rowStore.updateWhere(DriveTables.NODES,
                n -> nodeId.equals(n.id()) && actor.id().equals(n.ownerId()) && !n.deleted(),
                n -> n.withDeleted(true, now));
        if (updated.isEmpty()) {
            throw DriveException.notFound("文件或文件夹不存在：" + nodeId);
        }
        DriveNode node = updated.get(0);
        invalidateAffected(node);
        LOGGER.info("Moved node {} ({}) to trash by {}", node.path(), node.id(), actor.id());
        return node;
    }

    /**
     * 从回收站恢复：与移入回收站对称；原路径已被占用时拒绝（CONFLICT），不自动改名。
     *
     * @throws DriveException NOT_FOUND：回收站中不存在属于调用者的该节点
     */
    public DriveNode restore(Principal actor, String nodeId) {
        Principal.requireAuthenticated(actor);
        requireNodeId(nodeId);
        Instant now = clock.instant();
        List<DriveNode> updated;
        try {
            updated = rowStore.updateWhere(DriveTables.NODES,
                    n -> nodeId.equals(n.id()) && actor.id().equals(n.ownerId()) && n.deleted(),
                    n -> n.withDeleted(false, now));
        } catch (DriveException e) {
            if (e.getCode() == ErrorCode.CONFLICT) {
                throw new DriveException(ErrorCode.CONFLICT, "原路径已被其他节点占用，无法恢复：" + nodeId, e);
            }
            throw e;
        }
        if (updated.isEmpty()) {
            throw DriveException.notFound("回收站中不存在该文件或文件夹：" + nodeId);
        }
        DriveNode node = updated.get(0);
        invalidateAffected(node);
        LOGGER.info("Restored node {} ({}) from trash by {}", node.path(), node.id(), actor.id());
        return node;
    }

    /**
     * 改名：在同一父文件夹下计算新路径，需要 editor 及以上权限。
     *
     * @throws DriveException INVALID_INPUT：新名称为空；CONFLICT：目标路径已被占用
     */
    public DriveNode rename(Principal actor, String nodeId, String newName) {
        Principal.requireAuthenticated(actor);
        requireNodeId(nodeId);
        String validName = NodePaths.requireValidName(newName, "newName");
        DriveNode node = repository.findLive(nodeId)
                .orElseThrow(() -> DriveException.notFound("文件或文件夹不存在：" + nodeId));
        accessControl.require(actor, node, Role.EDITOR);

        String segment = NodePaths.renamedSegment(node, validName, clock.millis());
        String newPath = NodePaths.child(node.ownerId(), node.parentPath(), segment);
        if (newPath.equals(node.path()) && validName.equals(node.name())) {
            return node;
        }
        return relocate(actor, node, validName, node.parentPath(), newPath);
    }

    /**
     * 移动到另一个文件夹（{@code null} 表示所有者命名空间根），冲突规则与改名相同。
     * <p>
     * 目标文件夹必须是节点所有者名下的未删除文件夹；文件夹不能移动到自身或其子孙路径下。
     */
    public DriveNode move(Principal actor, String nodeId, String newParentPath) {
        Principal.requireAuthenticated(actor);
        requireNodeId(nodeId);
        DriveNode node = repository.findLive(nodeId)
                .orElseThrow(() -> DriveException.notFound("文件或文件夹不存在：" + nodeId));
        accessControl.require(actor, node, Role.EDITOR);

        String newParent = NodePaths.normalizeParent(newParentPath);
        if (newParent != null && node.isFolder() && NodePaths.isSameOrDescendant(newParent, node.path())) {
            throw DriveException.invalidInput("不能把文件夹移动到自身或其子文件夹下：" + newParent);
        }
        requireParentFolder(node.ownerId(), newParent);

        String newPath = NodePaths.child(node.ownerId(), newParent, NodePaths.lastSegment(node.path()));
        if (newPath.equals(node.path())) {
            return node;
        }
        return relocate(actor, node, node.name(), newParent, newPath);
    }

    /**
     * 彻底删除回收站中的节点：删除元数据、授权记录，最后删除对象。
     * <p>
     * 对象删除失败时异常原样抛出（元数据已删除，对象成为孤儿，需要人工清理）。
     */
    public DriveNode purge(Principal actor, String nodeId) {
        Principal.requireAuthenticated(actor);
        requireNodeId(nodeId);
        List<DriveNode> removed = rowStore.deleteWhere(DriveTables.NODES,
                n -> nodeId.equals(n.id()) && actor.id().equals(n.ownerId()) && n.deleted());
        if (removed.isEmpty()) {
            throw DriveException.notFound("回收站中不存在该文件或文件夹：" + nodeId);
        }
        DriveNode node = removed.get(0);
        Set<String> affected = new LinkedHashSet<>();
        affected.add(node.ownerId());
        rowStore.deleteWhere(DriveTables.GRANTS, g -> nodeId.equals(g.nodeId()))
                .forEach(g -> affected.add(g.granteeId()));
        cache.invalidateAll(affected);

        String key = resolver.resolve(node);
        try {
            objectStore.deleteObject(key);
        } catch (DriveException e) {
            LOGGER.warn("Purged node {} but failed to delete object {}", node.id(), key, e);
            throw e;
        }
        LOGGER.info("Purged node {} ({}) by {}", node.path(), node.id(), actor.id());
        return node;
    }

    /**
     * 先用条件更新占住目标路径（唯一键保证原子性），再移动对象；对象移动失败时把行条件回退。
     * <p>
     * 目标路径一旦被本次更新占住，并发的上传/新建会在插入行时得到 CONFLICT，不会写入对象，
     * 因此对象移动不可能覆盖其他节点的数据。
     */
    private DriveNode relocate(Principal actor, DriveNode node, String newName, String newParent, String newPath) {
        String oldKey = resolver.resolve(node);
        String newKey = node.isFolder() ? resolver.markerKey(newPath) : newPath;
        String newBackingKey = node.isFile() ? newKey : null;

        Instant now = clock.instant();
        List<DriveNode> updated;
        try {
            // 以“仍未删除且路径未变”为前置条件，与并发的删除/改名互斥
            updated = rowStore.updateWhere(DriveTables.NODES,
                    n -> node.id().equals(n.id()) && !n.deleted() && node.path().equals(n.path()),
                    n -> n.withLocation(newName, newParent, newPath, newBackingKey, now));
        } catch (DriveException e) {
            if (e.getCode() == ErrorCode.CONFLICT) {
                throw new DriveException(ErrorCode.CONFLICT, "目标路径已存在：" + newPath, e);
            }
            throw e;
        }
        if (updated.isEmpty()) {
            throw DriveException.notFound("节点已被删除或已被并发修改：" + node.id());
        }

        try {
            moveObject(node, oldKey, newKey);
        } catch (DriveException e) {
            revertLocation(node, newPath, e);
            invalidateAffected(node);
            throw e;
        }
        DriveNode result = updated.get(0);
        invalidateAffected(result);
        LOGGER.info("Relocated node {} from {} to {} by {}", node.id(), node.path(), newPath, actor.id());
        return result;
    }

    private void moveObject(DriveNode node, String oldKey, String newKey) {
        if (oldKey.equals(newKey)) {
            return;
        }
        try {
            objectStore.moveObject(oldKey, newKey);
        } catch (DriveException e) {
            if (node.isFolder() && e.getCode() == ErrorCode.NOT_FOUND) {
                // 文件夹占位对象缺失不影响改名
                LOGGER.debug("Folder marker {} missing, skipping object move", oldKey);
                return;
            }
            throw e;
        }
    }

    /**
     * 对象没有移动成功：把行从新路径条件回退到原位置（包括原 updatedAt）。
     * 原路径已被他人占用时回退失败，只记录日志并附加到原异常上。
     */
    private void revertLocation(DriveNode original, String claimedPath, DriveException cause) {
        try {
            List<DriveNode> reverted = rowStore.updateWhere(DriveTables.NODES,
                    n -> original.id().equals(n.id()) && claimedPath.equals(n.path()),
                    n -> n.withLocation(original.name(), original.parentPath(), original.path(),
                            original.backingKey(), original.updatedAt()));
            if (reverted.isEmpty()) {
                LOGGER.warn("Node {} left {} before its location could be reverted", original.id(), claimedPath);
            }
        } catch (DriveException e) {
            cause.addSuppressed(e);
            LOGGER.warn("Failed to revert node {} to {} after object move failure", original.id(), original.path(), e);
        }
    }

    private void rollbackInsert(DriveNode node, DriveException cause) {
        try {
            rowStore.deleteWhere(DriveTables.NODES, n -> node.id().equals(n.id()));
        } catch (DriveException e) {
            cause.addSuppressed(e);
            LOGGER.warn("Failed to roll back metadata for {} after object write failure", node.path(), e);
        }
    }

    private void requireParentFolder(String ownerId, String parentPath) {
        if (parentPath == null) {
            return;
        }
        repository.findLiveByPath(ownerId, parentPath)
                .filter(DriveNode::isFolder)
                .orElseThrow(() -> DriveException.notFound("父文件夹不存在：" + parentPath));
    }

    /**
     * 失效节点所有者以及所有被授权者的列表缓存。
     */
    private void invalidateAffected(DriveNode node) {
        Set<String> affected = new LinkedHashSet<>();
        affected.add(node.ownerId());
        if (node.id() != null) {
            for (PermissionGrant grant : repository.grantsForNode(node.id())) {
                affected.add(grant.granteeId());
            }
        }
        cache.invalidateAll(affected);
    }

    private static void requireNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw DriveException.invalidInput("nodeId 不能为空");
        }
    }
}
