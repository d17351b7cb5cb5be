package org.drive.metadata.store;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * 元数据核心依赖的“带过滤能力的行存储”契约。
 * <p>
 * 要求：
 * <ul>
 *   <li>单次调用内的“过滤 + 修改”对同一行是原子的（至少 read-committed），核心依赖它实现条件状态迁移。</li>
 *   <li>违反唯一约束时抛出 {@code CONFLICT}；超时/不可用时抛出 {@code TIMEOUT}/{@code UNAVAILABLE}。</li>
 * </ul>
 * 核心自身不加锁，所有并发正确性都建立在这些条件写入之上。
 */
public interface RowStore {

    /**
     * 插入一行；主键为空时由存储分配。
     *
     * @return 带主键的行
     */
    <T> T insert(Table<T> table, T record);

    /**
     * 对满足条件的行应用 patch。
     *
     * @return 修改后的行；没有命中时返回空列表
     */
    <T> List<T> updateWhere(Table<T> table, Predicate<? super T> predicate, UnaryOperator<T> patch);

    /**
     * 查询满足条件的行（按表的默认排序），并返回总数。
     */
    <T> PageSlice<T> selectWhere(Table<T> table, Predicate<? super T> predicate, PageRequest page);

    default <T> List<T> selectWhere(Table<T> table, Predicate<? super T> predicate) {
        return selectWhere(table, predicate, PageRequest.unpaged()).items();
    }

    /**
     * 删除满足条件的行。
     *
     * @return 被删除的行
     */
    <T> List<T> deleteWhere(Table<T> table, Predicate<? super T> predicate);
}
