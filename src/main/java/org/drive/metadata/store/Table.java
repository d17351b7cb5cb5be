package org.drive.metadata.store;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 行存储中一张表的描述：表名、主键读写方式、唯一键与默认排序。
 * <p>
 * 唯一键函数返回 {@code null} 表示该行不参与唯一约束（例如已进入回收站的节点不占用路径）。
 *
 * @param <T> 行类型（不可变 record）
 */
public final class Table<T> {

    private final String name;
    private final Function<T, String> idGetter;
    private final BiFunction<T, String, T> idAssigner;
    private final Function<T, Object> uniqueKey;
    private final Comparator<T> order;

    private Table(String name,
                  Function<T, String> idGetter,
                  BiFunction<T, String, T> idAssigner,
                  Function<T, Object> uniqueKey,
                  Comparator<T> order) {
        this.name = Objects.requireNonNull(name, "name");
        this.idGetter = Objects.requireNonNull(idGetter, "idGetter");
        this.idAssigner = Objects.requireNonNull(idAssigner, "idAssigner");
        this.uniqueKey = uniqueKey;
        this.order = order;
    }

    public static <T> Table<T> of(String name, Function<T, String> idGetter, BiFunction<T, String, T> idAssigner) {
        return new Table<>(name, idGetter, idAssigner, null, null);
    }

    public Table<T> withUniqueKey(Function<T, Object> uniqueKey) {
        return new Table<>(name, idGetter, idAssigner, Objects.requireNonNull(uniqueKey, "uniqueKey"), order);
    }

    public Table<T> orderedBy(Comparator<T> order) {
        return new Table<>(name, idGetter, idAssigner, uniqueKey, Objects.requireNonNull(order, "order"));
    }

    public String name() {
        return name;
    }

    public String idOf(T row) {
        return idGetter.apply(row);
    }

    public T assignId(T row, String id) {
        return idAssigner.apply(row, id);
    }

    /**
     * 该行的唯一键；未配置唯一约束或该行豁免时返回 {@code null}。
     */
    public Object uniqueKeyOf(T row) {
        return uniqueKey == null ? null : uniqueKey.apply(row);
    }

    public Comparator<T> order() {
        return order;
    }

    @Override
    public String toString() {
        return "Table[" + name + "]";
    }
}
