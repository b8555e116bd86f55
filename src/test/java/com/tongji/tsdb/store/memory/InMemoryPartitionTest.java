package com.tongji.tsdb.store.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.exception.StoreUnavailableException;
import com.tongji.tsdb.store.Replies;
import com.tongji.tsdb.store.StoreCommand;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPartitionTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryPartition partition = new InMemoryPartition("p", clock, 14, new ObjectMapper());

    private Object run(StoreCommand command) {
        return partition.execute(List.of(command)).get(0);
    }

    @Test
    void keys_expire_lazily_at_their_deadline() {
        run(c -> c.hincrBy("h", "f", 1));
        assertEquals(true, run(c -> c.expireAt("h", NOW.getEpochSecond() + 10)));
        assertEquals(NOW.getEpochSecond() + 10, partition.expiresAt("h"));

        clock.now = NOW.plusSeconds(9);
        assertEquals(1L, Replies.asLong(run(c -> c.hget("h", "f"))));

        clock.now = NOW.plusSeconds(10);
        assertNull(run(c -> c.hget("h", "f")));
        assertFalse(partition.keys().contains("h"));
    }

    @Test
    void expired_keys_are_purged_even_if_never_read_again() {
        run(c -> c.hincrBy("stale", "f", 1));
        run(c -> c.expireAt("stale", NOW.getEpochSecond() + 10));
        run(c -> c.hincrBy("fresh", "f", 1));
        assertEquals(2, partition.storedKeyCount());

        clock.now = NOW.plusSeconds(10);
        run(c -> c.hget("fresh", "f"));

        assertEquals(1, partition.storedKeyCount());
    }

    @Test
    void expire_at_on_missing_key_is_a_no_op() {
        assertEquals(false, run(c -> c.expireAt("missing", NOW.getEpochSecond() + 10)));
        assertTrue(partition.keys().isEmpty());
    }

    @Test
    void hincrby_clamps_at_long_max() {
        run(c -> c.hincrBy("h", "f", Long.MAX_VALUE - 1));

        assertEquals(Long.MAX_VALUE, Replies.asLong(run(c -> c.hincrBy("h", "f", 5))));
        assertEquals(Long.MAX_VALUE, Replies.asLong(run(c -> c.hget("h", "f"))));
    }

    @Test
    void hash_take_reads_and_removes_atomically() {
        run(c -> c.hincrBy("h", "a", 5));
        run(c -> c.hincrBy("h", "b", 1));

        assertEquals(5L, Replies.asLong(run(c -> c.hashTake("h", "a"))));
        assertNull(run(c -> c.hashTake("h", "a")));
        assertEquals(1L, Replies.asLong(run(c -> c.hdel("h", "b", "zzz"))));
        assertFalse(partition.keys().contains("h"), "empty hash disappears");
    }

    @Test
    void hyperloglog_raw_bytes_survive_a_round_trip_through_set() {
        run(c -> c.pfadd("src", "a", "b", "c"));
        byte[] raw = Replies.asBytes(run(c -> c.get("src")));

        run(c -> c.setWithTtl("copy", raw, 60));
        run(c -> c.pfadd("other", "c", "d"));
        run(c -> c.pfmerge("dest", "copy", "other"));

        assertEquals(4L, Replies.asLong(run(c -> c.pfcount("dest"))));
        assertEquals(4L, Replies.asLong(run(c -> c.pfcount("src", "other"))));
        assertEquals(NOW.getEpochSecond() + 60, partition.expiresAt("copy"));
    }

    @Test
    void pfcount_of_missing_key_is_zero() {
        assertEquals(0L, Replies.asLong(run(c -> c.pfcount("nothing"))));
        assertNull(run(c -> c.get("nothing")));
    }

    @Test
    void unavailable_partition_rejects_pipelines() {
        partition.setAvailable(false);

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> run(c -> c.del("k")));
        assertEquals("p", ex.getPartition());
        assertEquals(0, partition.pipelineCount());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
