package com.tongji.tsdb.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tongji.tsdb.config.TsdbProperties;
import com.tongji.tsdb.exception.ErrorCode;
import com.tongji.tsdb.exception.StoreUnavailableException;
import com.tongji.tsdb.exception.ValidationException;
import com.tongji.tsdb.store.ClusterGroup;
import com.tongji.tsdb.store.Partition;
import com.tongji.tsdb.store.memory.InMemoryPartition;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurabilityGuardTest {

    private final ClusterGroup cluster = new ClusterGroup("c",
            List.<Partition>of(new InMemoryPartition("p0", Clock.systemUTC(), 12, new ObjectMapper())), Runnable::run);
    private final Route durable = new Route(cluster, true);
    private final Route bestEffort = new Route(cluster, false);
    private final DurabilityGuard guard = new DurabilityGuard(TsdbProperties.ReadFailure.SUPPRESS);

    private static Runnable failing() {
        return () -> {
            throw new StoreUnavailableException("p0", "connection refused");
        };
    }

    @Test
    void durable_route_propagates_store_failures() {
        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> guard.write(durable, failing()));
        assertEquals(ErrorCode.STORE_UNAVAILABLE, ex.getErrorCode());
    }

    @Test
    void best_effort_route_reports_suppressed_failure() {
        WriteOutcome outcome = guard.write(bestEffort, failing());

        assertFalse(outcome.isDelivered());
        assertEquals(1, outcome.getSuppressed().size());
        assertEquals("p0", outcome.getSuppressed().get(0).getPartition());
    }

    @Test
    void successful_write_is_delivered() {
        WriteOutcome outcome = guard.write(bestEffort, () -> { });

        assertTrue(outcome.isDelivered());
        assertSame(WriteOutcome.delivered(), outcome);
    }

    @Test
    void validation_errors_are_never_suppressed() {
        assertThrows(ValidationException.class, () -> guard.write(bestEffort, () -> {
            throw new ValidationException(ErrorCode.INVALID_ARGUMENT, "bad");
        }));
    }

    @Test
    void outcomes_accumulate_suppressed_failures() {
        WriteOutcome merged = WriteOutcome.delivered()
                .and(guard.write(bestEffort, failing()))
                .and(WriteOutcome.delivered())
                .and(guard.write(bestEffort, failing()));

        assertEquals(2, merged.getSuppressed().size());
    }

    @Test
    void reads_fall_back_by_default() {
        Long value = guard.read(() -> {
            throw new StoreUnavailableException("p0", "timeout");
        }, () -> 0L);

        assertEquals(0L, value);
    }

    @Test
    void reads_can_be_configured_to_propagate() {
        DurabilityGuard strict = new DurabilityGuard(TsdbProperties.ReadFailure.PROPAGATE);

        assertThrows(StoreUnavailableException.class, () -> strict.read(() -> {
            throw new StoreUnavailableException("p0", "timeout");
        }, () -> 0L));
    }
}
