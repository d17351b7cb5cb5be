package org.drive.metadata.dto;

import org.drive.metadata.DriveNode;

import java.util.List;

/**
 * 搜索结果（分页）。
 *
 * @param principalId 搜索所属主体
 * @param query       搜索关键字
 * @param items       当前页条目
 * @param total       命中总数
 * @param page        页号（从 1 开始）
 * @param limit       分页大小
 * @param totalPages  总页数，{@code ceil(total / limit)}
 */
public record SearchResult(
        String principalId,
        String query,
        List<DriveNode> items,
        long total,
        int page,
        int limit,
        int totalPages
) {
    public SearchResult {
        items = List.copyOf(items);
    }
}
