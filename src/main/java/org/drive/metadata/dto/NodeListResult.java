package org.drive.metadata.dto;

import org.drive.metadata.DriveNode;

import java.util.List;

/**
 * 节点列表（我的文件 / 回收站）的返回结果。
 *
 * @param principalId 列表所属主体
 * @param total       条目数
 * @param items       条目（按创建时间排序）
 */
public record NodeListResult(
        String principalId,
        int total,
        List<DriveNode> items
) {
    public NodeListResult {
        items = List.copyOf(items);
    }

    public static NodeListResult of(String principalId, List<DriveNode> items) {
        return new NodeListResult(principalId, items.size(), items);
    }
}
