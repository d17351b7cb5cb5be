package org.drive.metadata;

import org.drive.metadata.dto.NodeListResult;
import org.drive.metadata.dto.SearchResult;
import org.drive.metadata.dto.SharedItem;
import org.drive.metadata.dto.SharedItemsResult;
import org.drive.metadata.store.PageRequest;
import org.drive.metadata.store.PageSlice;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 只读查询：我的文件、搜索、共享给我、回收站。
 * <p>
 * 前三者走 {@link ListingCache} 读穿透；缓存未命中只是透明地回落到行存储，不会作为错误抛出。
 * 回收站列表不缓存。
 */
public class DriveQueryService {

    private final NodeRepository repository;
    private final ListingCache cache;
    private final DriveProperties properties;

    public DriveQueryService(NodeRepository repository, ListingCache cache, DriveProperties properties) {
        this.repository = repository;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * 列出主体名下全部未删除节点（按创建时间排序）。
     */
    public NodeListResult listItems(Principal principal) {
        Principal.requireAuthenticated(principal);
        ListingCache.CacheKey key = ListingCache.CacheKey.of(principal.id(), ListingCache.QueryShape.LIST_ITEMS);
        return cache.getOrLoad(key, NodeListResult.class,
                () -> NodeListResult.of(principal.id(), repository.listLive(principal.id())));
    }

    /**
     * 按名称或路径搜索（不区分大小写，分页）。
     *
     * @param page  页号，从 1 开始；为空默认 1
     * @param limit 分页大小；为空使用 {@code app.drive.search-default-limit}
     */
    public SearchResult search(Principal principal, String query, Integer page, Integer limit) {
        Principal.requireAuthenticated(principal);
        if (query == null || query.isBlank()) {
            throw DriveException.invalidInput("搜索关键字 query 不能为空");
        }
        int resolvedPage = (page == null) ? 1 : page;
        int resolvedLimit = (limit == null) ? properties.getSearchDefaultLimit() : limit;
        if (resolvedLimit > properties.getSearchMaxLimit()) {
            throw DriveException.invalidInput("limit 超过上限 " + properties.getSearchMaxLimit() + "：" + resolvedLimit);
        }
        PageRequest pageRequest = PageRequest.ofPage(resolvedPage, resolvedLimit);
        String needle = query.trim();

        ListingCache.CacheKey key = ListingCache.CacheKey.of(principal.id(), ListingCache.QueryShape.SEARCH,
                needle, resolvedPage, resolvedLimit);
        return cache.getOrLoad(key, SearchResult.class, () -> {
            PageSlice<DriveNode> slice = repository.searchLive(principal.id(), needle, pageRequest);
            return new SearchResult(
                    principal.id(),
                    needle,
                    slice.items(),
                    slice.total(),
                    resolvedPage,
                    resolvedLimit,
                    PageRequest.totalPages(slice.total(), resolvedLimit)
            );
        });
    }

    /**
     * 列出其他主体授权给我的未删除节点及我的角色。
     */
    public SharedItemsResult listSharedWithMe(Principal principal) {
        Principal.requireAuthenticated(principal);
        ListingCache.CacheKey key = ListingCache.CacheKey.of(principal.id(), ListingCache.QueryShape.LIST_SHARED);
        return cache.getOrLoad(key, SharedItemsResult.class, () -> {
            Map<String, Role> roles = new HashMap<>();
            for (PermissionGrant grant : repository.grantsForGrantee(principal.id())) {
                roles.put(grant.nodeId(), grant.role());
            }
            List<SharedItem> items = new ArrayList<>();
            for (DriveNode node : repository.listLiveByIds(roles.keySet())) {
                items.add(new SharedItem(node, roles.get(node.id())));
            }
            return new SharedItemsResult(principal.id(), items);
        });
    }

    /**
     * 列出主体回收站中的节点。
     */
    public NodeListResult listTrash(Principal principal) {
        Principal.requireAuthenticated(principal);
        return NodeListResult.of(principal.id(), repository.listTrashed(principal.id()));
    }
}
