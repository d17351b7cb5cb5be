package org.drive.metadata;

/**
 * 把节点解析为对象存储中的 key。
 * <ul>
 *   <li>文件：直接返回 backingKey。</li>
 *   <li>文件夹：返回 {@code path + "/" + markerName}（默认 {@code .keep}），即代表文件夹本身的占位对象。</li>
 * </ul>
 */
public class ObjectReferenceResolver {

    private final String markerName;

    public ObjectReferenceResolver(String markerName) {
        this.markerName = NodePaths.requireValidName(markerName, "folder-marker-name");
    }

    public String resolve(DriveNode node) {
        if (node == null) {
            throw DriveException.notFound("节点不存在");
        }
        if (node.isFolder()) {
            return markerKey(node.path());
        }
        if (node.backingKey() == null || node.backingKey().isBlank()) {
            // 文件节点一定有 backingKey，缺失说明数据已损坏
            throw DriveException.internal("文件节点缺少 backingKey：" + node.id());
        }
        return node.backingKey();
    }

    public String markerKey(String folderPath) {
        return folderPath + "/" + markerName;
    }
}
