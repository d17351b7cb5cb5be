package org.drive.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 列表/搜索结果的读穿透缓存（内存版，带 TTL）。
 * <p>
 * 设计目标：
 * <ul>
 *   <li>以“主体 + 查询形态 + 参数”为 key 缓存一次查询的完整结果（包含分页参数）。</li>
 *   <li>写操作必须在返回成功前调用 {@link #invalidate(String)}，按主体粗粒度清空其全部条目；
 *       写后读不能依赖 TTL 过期，陈旧列表属于正确性问题。</li>
 *   <li>TTL 从写入时刻起算，命中不续期；容量超限时淘汰最久未访问的条目。</li>
 * </ul>
 * <p>
 * 并发说明：
 * <ul>
 *   <li>所有结构操作在同一把锁内完成（synchronized + LinkedHashMap）。</li>
 *   <li>每个主体维护一个失效代数（generation）；{@link #getOrLoad} 在查询前记下代数，
 *       写回时代数已变化说明期间发生过失效，此时丢弃结果，避免把失效前读到的旧数据重新写回缓存。</li>
 *   <li>代数取自全局递增计数器，不会重复。被记录的主体数超过容量上限时整体清空，并把“未记录主体”的基准代数
 *       推进到一个新值：清空前记下的任何代数都不再匹配，最多让进行中的读穿透少写一次缓存。</li>
 * </ul>
 * <p>
 * 生命周期：进程启动时由 Spring 容器创建一次，通过依赖注入交给各服务，进程内不销毁。
 */
public class ListingCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListingCache.class);

    private final boolean enabled;
    private final Clock clock;
    private final long ttlMillis;
    private final int maxEntries;
    private final Object lock = new Object();

    // accessOrder=true：每次 get 会把条目移到末尾，实现近似 LRU
    private final LinkedHashMap<CacheKey, CacheValue> map = new LinkedHashMap<>(128, 0.75f, true);
    private final HashMap<String, Long> generations = new HashMap<>();
    private long generationCounter;
    private long baselineGeneration;

    public ListingCache(DriveProperties properties, Clock clock) {
        this(properties.isCacheEnabled(), properties.getCacheTtl(), properties.getCacheMaxEntries(), clock);
    }

    public ListingCache(boolean enabled, Duration ttl, int maxEntries, Clock clock) {
        this.enabled = enabled;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlMillis = safeToMillis(ttl, Duration.ofSeconds(300));
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * 是否启用缓存（由 {@code app.drive.cache-enabled} 控制）。
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * 读取缓存；未命中或已过期返回 {@code null}。
     */
    public Object get(CacheKey key) {
        if (!enabled || key == null) {
            return null;
        }
        long now = clock.millis();
        synchronized (lock) {
            CacheValue value = map.get(key);
            if (value == null) {
                return null;
            }
            if (value.expiresAtMs <= now) {
                map.remove(key);
                return null;
            }
            return value.value;
        }
    }

    public <V> V get(CacheKey key, Class<V> type) {
        Object value = get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    /**
     * 直接写入缓存（后写覆盖先写）。
     */
    public void put(CacheKey key, Object value) {
        if (!enabled || key == null || value == null) {
            return;
        }
        synchronized (lock) {
            store(key, value);
        }
    }

    /**
     * 主体当前的失效代数。
     */
    public long generation(String principalId) {
        synchronized (lock) {
            return currentGeneration(principalId);
        }
    }

    /**
     * 仅当主体的失效代数仍等于 {@code observedGeneration} 时写入。
     *
     * @return 是否写入
     */
    public boolean putIfCurrent(CacheKey key, Object value, long observedGeneration) {
        if (!enabled || key == null || value == null) {
            return false;
        }
        synchronized (lock) {
            if (currentGeneration(key.principalId()) != observedGeneration) {
                return false;
            }
            store(key, value);
            return true;
        }
    }

    /**
     * 读穿透：命中直接返回；未命中时调用 loader 查询并写回（写回受失效代数保护）。
     * <p>
     * loader 抛出的异常原样传播，不写缓存。
     */
    public <V> V getOrLoad(CacheKey key, Class<V> type, Supplier<V> loader) {
        if (!enabled) {
            return loader.get();
        }
        V cached = get(key, type);
        if (cached != null) {
            return cached;
        }
        long observed = generation(key.principalId());
        V loaded = loader.get();
        if (!putIfCurrent(key, loaded, observed)) {
            LOGGER.debug("Discarded listing for {} ({}): invalidated while loading", key.principalId(), key.shape());
        }
        return loaded;
    }

    /**
     * 失效某个主体的全部缓存条目（不区分查询形态与参数）。
     *
     * @return 被移除的条目数
     */
    public int invalidate(String principalId) {
        if (principalId == null) {
            return 0;
        }
        int removed = 0;
        synchronized (lock) {
            // 即使缓存关闭也推进代数，保证进行中的读穿透不会写回
            generations.put(principalId, ++generationCounter);
            if (generations.size() > maxEntries) {
                pruneGenerations();
            }
            Iterator<CacheKey> it = map.keySet().iterator();
            while (it.hasNext()) {
                if (principalId.equals(it.next().principalId())) {
                    it.remove();
                    removed++;
                }
            }
        }
        LOGGER.debug("Invalidated {} cached listing(s) for principal {}", removed, principalId);
        return removed;
    }

    public void invalidateAll(Collection<String> principalIds) {
        for (String principalId : principalIds) {
            invalidate(principalId);
        }
    }

    public int size() {
        synchronized (lock) {
            return map.size();
        }
    }

    int trackedPrincipals() {
        synchronized (lock) {
            return generations.size();
        }
    }

    private long currentGeneration(String principalId) {
        Long generation = generations.get(principalId);
        return (generation == null) ? baselineGeneration : generation;
    }

    private void pruneGenerations() {
        int dropped = generations.size();
        generations.clear();
        baselineGeneration = ++generationCounter;
        LOGGER.debug("Pruned {} principal generation(s), baseline now {}", dropped, baselineGeneration);
    }

    private void store(CacheKey key, Object value) {
        map.put(key, new CacheValue(value, clock.millis() + ttlMillis));
        // 超出容量则淘汰最旧的条目
        while (map.size() > maxEntries) {
            Iterator<Map.Entry<CacheKey, CacheValue>> it = map.entrySet().iterator();
            if (!it.hasNext()) {
                break;
            }
            it.next();
            it.remove();
        }
    }

    private static long safeToMillis(Duration duration, Duration fallback) {
        Duration d = (duration == null) ? fallback : duration;
        try {
            return Math.max(1, d.toMillis());
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE / 2;
        }
    }

    /**
     * 查询形态。
     */
    public enum QueryShape {
        LIST_ITEMS,
        SEARCH,
        LIST_SHARED
    }

    /**
     * 缓存 key：严格对应一次查询的输入参数（例如搜索的关键字/页号/分页大小）。
     */
    public record CacheKey(String principalId, QueryShape shape, List<Object> parameters) {
        public CacheKey {
            Objects.requireNonNull(principalId, "principalId");
            Objects.requireNonNull(shape, "shape");
            parameters = (parameters == null) ? List.of() : List.copyOf(parameters);
        }

        public static CacheKey of(String principalId, QueryShape shape, Object... parameters) {
            return new CacheKey(principalId, shape, List.of(parameters));
        }
    }

    private record CacheValue(Object value, long expiresAtMs) {
    }
}
