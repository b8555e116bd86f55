package com.tongji.tsdb.store.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.exception.StoreUnavailableException;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.PartitionCommands;
import com.tongji.tsdb.store.StoreCommand;
import lombok.extern.slf4j.Slf4j;
import org.apache.datasketches.hll.HllSketch;
import org.apache.datasketches.hll.TgtHllType;
import org.apache.datasketches.hll.Union;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 进程内分区：与 Redis 分区遵守同一线协议，用于本地开发与测试。
 *
 * <p>实现要点：</p>
 * - 一次管道整体持锁执行，等价于 Redis 单线程顺序执行；
 * - 过期按注入的 {@link Clock} 判定：访问时清理单个键，每次管道执行前清理全部过期键；
 * - HyperLogLog 由 Apache DataSketches {@link HllSketch} 承担，原始值为其紧凑序列化字节；
 * - {@link #setAvailable(boolean)} 可模拟分区宕机。
 */
@Slf4j
public class InMemoryPartition implements Partition {

    private final String name;
    private final Clock clock;
    private final int lgK;
    private final Map<String, Slot> keyspace = new HashMap<>();
    private final InMemoryCountMinSketch countMin;
    private final AtomicInteger pipelines = new AtomicInteger();
    private volatile boolean available = true;

    public InMemoryPartition(String name, Clock clock, int lgK, ObjectMapper objectMapper) {
        this.name = name;
        this.clock = clock;
        this.lgK = lgK;
        this.countMin = new InMemoryCountMinSketch(this, objectMapper);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Object> execute(List<StoreCommand> commands) {
        if (!available) {
            throw new StoreUnavailableException(name, "Partition " + name + " is unavailable");
        }
        pipelines.incrementAndGet();
        synchronized (keyspace) {
            purgeExpired();
            PartitionCommands ops = new Commands();
            List<Object> results = new ArrayList<>(commands.size());
            for (StoreCommand command : commands) {
                results.add(command.issue(ops));
            }
            return results;
        }
    }

    public void setAvailable(boolean available) {
        this.available = available;
        log.info("In-memory partition availability changed name={} available={}", name, available);
    }

    /** 已执行的管道数量（每次 execute 计一次）。 */
    public int pipelineCount() {
        return pipelines.get();
    }

    public Set<String> keys() {
        synchronized (keyspace) {
            purgeExpired();
            return new TreeSet<>(keyspace.keySet());
        }
    }

    /** 键空间中实际保存的键数（含尚未清理的过期键）。 */
    int storedKeyCount() {
        synchronized (keyspace) {
            return keyspace.size();
        }
    }

    /** 键的绝对过期时间（秒），无过期或键不存在时为 null。 */
    public Long expiresAt(String key) {
        synchronized (keyspace) {
            Slot slot = slot(key);
            return slot == null ? null : slot.expireAt;
        }
    }

    // ---- 键空间原语（调用方已持锁） ----

    Slot slot(String key) {
        Slot slot = keyspace.get(key);
        if (slot != null && expired(key)) {
            keyspace.remove(key);
            return null;
        }
        return slot;
    }

    @SuppressWarnings("unchecked")
    Map<String, Long> hash(String key, boolean create) {
        Slot slot = slot(key);
        if (slot == null) {
            if (!create) {
                return null;
            }
            slot = new Slot(new HashMap<String, Long>());
            keyspace.put(key, slot);
        }
        return (Map<String, Long>) slot.value;
    }

    @SuppressWarnings("unchecked")
    Map<String, Double> zset(String key, boolean create) {
        Slot slot = slot(key);
        if (slot == null) {
            if (!create) {
                return null;
            }
            slot = new Slot(new HashMap<String, Double>());
            keyspace.put(key, slot);
        }
        return (Map<String, Double>) slot.value;
    }

    boolean delete(String key) {
        return slot(key) != null && keyspace.remove(key) != null;
    }

    /** 空容器等价于不存在的键。 */
    void dropIfEmpty(String key) {
        Slot slot = keyspace.get(key);
        if (slot != null && slot.value instanceof Map<?, ?> map && map.isEmpty()) {
            keyspace.remove(key);
        }
    }

    private void purgeExpired() {
        long now = clock.instant().getEpochSecond();
        keyspace.values().removeIf(slot -> slot.expireAt != null && now >= slot.expireAt);
    }

    private boolean expired(String key) {
        Slot slot = keyspace.get(key);
        return slot != null && slot.expireAt != null && clock.instant().getEpochSecond() >= slot.expireAt;
    }

    private HllSketch hll(String key, boolean create) {
        Slot slot = slot(key);
        if (slot == null) {
            if (!create) {
                return null;
            }
            slot = new Slot(new HllSketch(lgK, TgtHllType.HLL_8));
            keyspace.put(key, slot);
        }
        if (slot.value instanceof byte[] raw) {
            // 由 SET 写入的原始值在首次按 HyperLogLog 使用时反序列化
            slot.value = HllSketch.heapify(raw);
        }
        if (!(slot.value instanceof HllSketch)) {
            throw new IllegalStateException("WRONGTYPE key " + key + " is not a HyperLogLog");
        }
        return (HllSketch) slot.value;
    }

    static final class Slot {
        Object value;
        Long expireAt;

        Slot(Object value) {
            this.value = value;
        }
    }

    private final class Commands implements PartitionCommands {

        @Override
        public Object hincrBy(String key, String field, long delta) {
            return hash(key, true).merge(field, delta, PartitionCommands::saturatedAdd);
        }

        @Override
        public Object hget(String key, String field) {
            Map<String, Long> hash = hash(key, false);
            return hash == null ? null : hash.get(field);
        }

        @Override
        public Object hdel(String key, String... fields) {
            Map<String, Long> hash = hash(key, false);
            if (hash == null) {
                return 0L;
            }
            long removed = 0;
            for (String field : fields) {
                if (hash.remove(field) != null) {
                    removed++;
                }
            }
            dropIfEmpty(key);
            return removed;
        }

        @Override
        public Object hashTake(String key, String field) {
            Map<String, Long> hash = hash(key, false);
            if (hash == null) {
                return null;
            }
            Long value = hash.remove(field);
            dropIfEmpty(key);
            return value;
        }

        @Override
        public Object expireAt(String key, long unixSeconds) {
            Slot slot = slot(key);
            if (slot == null) {
                return false;
            }
            slot.expireAt = unixSeconds;
            return true;
        }

        @Override
        public Object del(String... keys) {
            long removed = 0;
            for (String key : keys) {
                if (delete(key)) {
                    removed++;
                }
            }
            return removed;
        }

        @Override
        public Object pfadd(String key, String... values) {
            HllSketch sketch = hll(key, true);
            double before = sketch.getEstimate();
            for (String value : values) {
                sketch.update(value);
            }
            return sketch.getEstimate() != before ? 1L : 0L;
        }

        @Override
        public Object pfcount(String... keys) {
            if (keys.length == 1) {
                HllSketch sketch = hll(keys[0], false);
                return sketch == null ? 0L : Math.round(sketch.getEstimate());
            }
            Union union = new Union(lgK);
            for (String key : keys) {
                HllSketch sketch = hll(key, false);
                if (sketch != null) {
                    union.update(sketch);
                }
            }
            return Math.round(union.getResult(TgtHllType.HLL_8).getEstimate());
        }

        @Override
        public Object pfmerge(String destination, String... sources) {
            Union union = new Union(lgK);
            HllSketch existing = hll(destination, false);
            if (existing != null) {
                union.update(existing);
            }
            for (String source : sources) {
                HllSketch sketch = hll(source, false);
                if (sketch != null) {
                    union.update(sketch);
                }
            }
            Slot slot = slot(destination);
            Long expireAt = slot == null ? null : slot.expireAt;
            Slot merged = new Slot(union.getResult(TgtHllType.HLL_8));
            merged.expireAt = expireAt;
            keyspace.put(destination, merged);
            return 1L;
        }

        @Override
        public Object get(String key) {
            Slot slot = slot(key);
            if (slot == null) {
                return null;
            }
            if (slot.value instanceof HllSketch sketch) {
                return sketch.toCompactByteArray();
            }
            if (slot.value instanceof byte[] raw) {
                return raw.clone();
            }
            throw new IllegalStateException("WRONGTYPE key " + key + " holds no string value");
        }

        @Override
        public Object setWithTtl(String key, byte[] value, long ttlSeconds) {
            Slot slot = new Slot(value.clone());
            slot.expireAt = clock.instant().getEpochSecond() + ttlSeconds;
            keyspace.put(key, slot);
            return 1L;
        }

        @Override
        public Object countMin(List<String> keys, List<String> arguments) {
            return countMin.execute(keys, arguments);
        }
    }
}
