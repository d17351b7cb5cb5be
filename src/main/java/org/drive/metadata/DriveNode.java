package org.drive.metadata;

import java.time.Instant;
import java.util.Objects;

/**
 * 文件/文件夹元数据记录。
 * <p>
 * 不变量：
 * <ul>
 *   <li>同一 owner 下，未删除节点的 path 唯一；回收站中的节点不占用路径。</li>
 *   <li>文件夹没有 backingKey；文件总有 backingKey（缺失属于数据完整性问题）。</li>
 *   <li>id、ownerId、kind 创建后不可变。</li>
 * </ul>
 *
 * @param id         存储分配的标识（插入前为 null）
 * @param ownerId    所有者主体标识
 * @param name       展示名称
 * @param path       逻辑路径（统一使用 / 分隔，以 ownerId 开头）
 * @param kind       文件/文件夹
 * @param parentPath 所在文件夹的路径；位于命名空间根时为 null
 * @param deleted    是否在回收站中
 * @param backingKey 对象存储中的 key（仅文件）
 * @param createdAt  创建时间
 * @param updatedAt  最后一次改名/移动的时间
 * @param trashedAt  移入回收站的时间；未删除时为 null
 */
public record DriveNode(
        String id,
        String ownerId,
        String name,
        String path,
        NodeKind kind,
        String parentPath,
        boolean deleted,
        String backingKey,
        Instant createdAt,
        Instant updatedAt,
        Instant trashedAt
) {

    public DriveNode {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        if (kind == NodeKind.FOLDER && backingKey != null) {
            throw new IllegalArgumentException("文件夹节点不能有 backingKey：" + path);
        }
    }

    public boolean isFolder() {
        return kind == NodeKind.FOLDER;
    }

    public boolean isFile() {
        return kind == NodeKind.FILE;
    }

    public boolean isLive() {
        return !deleted;
    }

    public DriveNode withId(String newId) {
        return new DriveNode(newId, ownerId, name, path, kind, parentPath, deleted, backingKey, createdAt, updatedAt, trashedAt);
    }

    /**
     * 切换回收站状态；其余字段保持不变，恢复后与删除前完全一致。
     */
    public DriveNode withDeleted(boolean newDeleted, Instant now) {
        return new DriveNode(id, ownerId, name, path, kind, parentPath, newDeleted, backingKey, createdAt, updatedAt,
                newDeleted ? now : null);
    }

    public DriveNode withLocation(String newName, String newParentPath, String newPath, String newBackingKey, Instant now) {
        return new DriveNode(id, ownerId, newName, newPath, kind, newParentPath, deleted, newBackingKey, createdAt, now, trashedAt);
    }
}
