package org.drive.metadata.store;

import org.drive.metadata.DriveException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * 行存储的内存实现（单进程）。
 * <p>
 * 说明：
 * <ul>
 *   <li>每张表一把锁（synchronized + LinkedHashMap），单次调用内的过滤与修改是原子的，隔离级别强于 read-committed。</li>
 *   <li>LinkedHashMap 保留插入顺序；表的默认排序使用稳定排序，排序键相同时按插入顺序返回。</li>
 *   <li>唯一键通过一个“唯一键 -> 主键”的索引维护，insert/update 违反约束时整体失败并抛出 CONFLICT。</li>
 * </ul>
 */
public class InMemoryRowStore implements RowStore {

    private final ConcurrentHashMap<String, TableData<?>> tables = new ConcurrentHashMap<>();

    @Override
    public <T> T insert(Table<T> table, T record) {
        Objects.requireNonNull(record, "record");
        TableData<T> data = data(table);
        synchronized (data) {
            String id = table.idOf(record);
            T row = record;
            if (id == null || id.isBlank()) {
                id = UUID.randomUUID().toString();
                row = table.assignId(record, id);
            }
            if (data.rows.containsKey(id)) {
                throw DriveException.conflict(table.name() + " 主键已存在：" + id);
            }
            Object key = table.uniqueKeyOf(row);
            if (key != null && data.uniqueIndex.containsKey(key)) {
                throw DriveException.conflict(table.name() + " 唯一约束冲突：" + key);
            }
            data.rows.put(id, row);
            if (key != null) {
                data.uniqueIndex.put(key, id);
            }
            return row;
        }
    }

    @Override
    public <T> List<T> updateWhere(Table<T> table, Predicate<? super T> predicate, UnaryOperator<T> patch) {
        TableData<T> data = data(table);
        synchronized (data) {
            // 先计算全部修改结果并校验约束，全部通过后再落盘，避免部分更新
            Map<String, T> patched = new LinkedHashMap<>();
            for (Map.Entry<String, T> e : data.rows.entrySet()) {
                if (!predicate.test(e.getValue())) {
                    continue;
                }
                T updated = patch.apply(e.getValue());
                if (!e.getKey().equals(table.idOf(updated))) {
                    throw DriveException.internal(table.name() + " 不允许修改主键：" + e.getKey());
                }
                patched.put(e.getKey(), updated);
            }
            if (patched.isEmpty()) {
                return List.of();
            }

            Map<Object, String> claimed = new HashMap<>();
            for (Map.Entry<String, T> e : patched.entrySet()) {
                Object key = table.uniqueKeyOf(e.getValue());
                if (key == null) {
                    continue;
                }
                String holder = data.uniqueIndex.get(key);
                boolean heldByOther = holder != null && !holder.equals(e.getKey()) && !releases(table, patched, holder, key);
                if (heldByOther || claimed.putIfAbsent(key, e.getKey()) != null) {
                    throw DriveException.conflict(table.name() + " 唯一约束冲突：" + key);
                }
            }

            for (Map.Entry<String, T> e : patched.entrySet()) {
                Object oldKey = table.uniqueKeyOf(data.rows.get(e.getKey()));
                if (oldKey != null) {
                    data.uniqueIndex.remove(oldKey, e.getKey());
                }
            }
            for (Map.Entry<String, T> e : patched.entrySet()) {
                data.rows.put(e.getKey(), e.getValue());
                Object key = table.uniqueKeyOf(e.getValue());
                if (key != null) {
                    data.uniqueIndex.put(key, e.getKey());
                }
            }
            return new ArrayList<>(patched.values());
        }
    }

    @Override
    public <T> PageSlice<T> selectWhere(Table<T> table, Predicate<? super T> predicate, PageRequest page) {
        PageRequest resolved = (page == null) ? PageRequest.unpaged() : page;
        TableData<T> data = data(table);
        List<T> matched = new ArrayList<>();
        synchronized (data) {
            for (T row : data.rows.values()) {
                if (predicate.test(row)) {
                    matched.add(row);
                }
            }
        }
        if (table.order() != null) {
            matched.sort(table.order());
        }
        int total = matched.size();
        if (resolved.offset() >= total) {
            return new PageSlice<>(List.of(), total);
        }
        int from = (int) resolved.offset();
        int to = (int) Math.min(total, from + (long) resolved.limit());
        return new PageSlice<>(matched.subList(from, to), total);
    }

    @Override
    public <T> List<T> deleteWhere(Table<T> table, Predicate<? super T> predicate) {
        TableData<T> data = data(table);
        List<T> removed = new ArrayList<>();
        synchronized (data) {
            Iterator<Map.Entry<String, T>> it = data.rows.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, T> e = it.next();
                if (!predicate.test(e.getValue())) {
                    continue;
                }
                Object key = table.uniqueKeyOf(e.getValue());
                if (key != null) {
                    data.uniqueIndex.remove(key, e.getKey());
                }
                removed.add(e.getValue());
                it.remove();
            }
        }
        return removed;
    }

    // 同一批更新中，原持有者自己也被更新且不再持有该键时，视为键已释放
    private static <T> boolean releases(Table<T> table, Map<String, T> patched, String holder, Object key) {
        T updatedHolder = patched.get(holder);
        return updatedHolder != null && !key.equals(table.uniqueKeyOf(updatedHolder));
    }

    @SuppressWarnings("unchecked")
    private <T> TableData<T> data(Table<T> table) {
        return (TableData<T>) tables.computeIfAbsent(table.name(), k -> new TableData<T>());
    }

    private static final class TableData<T> {
        private final LinkedHashMap<String, T> rows = new LinkedHashMap<>();
        private final HashMap<Object, String> uniqueIndex = new HashMap<>();
    }
}
