package org.drive.metadata.dto;

import java.util.List;

/**
 * “共享给我”的列表。
 *
 * @param principalId 被授权主体
 * @param items       条目
 */
public record SharedItemsResult(
        String principalId,
        List<SharedItem> items
) {
    public SharedItemsResult {
        items = List.copyOf(items);
    }
}
