package org.drive.metadata.store;

import java.util.List;

/**
 * 一次带分页的查询结果。
 *
 * @param items 当前页的行
 * @param total 满足条件的总行数（不受分页影响）
 */
public record PageSlice<T>(List<T> items, long total) {

    public PageSlice {
        items = List.copyOf(items);
    }
}
