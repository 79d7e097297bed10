package com.acme.eventlog.integration;

import com.acme.eventlog.spi.EventLog;
import com.acme.eventlog.spi.EventLog.Event;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@MicronautTest(environments = "integration", transactional = false)
@EnabledIfEnvironmentVariable(named = "POSTGRES_URL", matches = ".+")
class PgEventLogIntegrationTest {

    @Inject
    EventLog eventLog;

    @Inject
    TransactionOperations<Connection> transactionOps;

    @Inject
    IntegrationTestBase database;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        database.reset();
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private Event append(String eventType) {
        return transactionOps.executeWrite(status -> eventLog.append("person", eventType, "{\"name\":\"x\"}"));
    }

    @Test
    void testAppendRequiresTransaction() {
        assertThrows(IllegalStateException.class, () -> eventLog.append("person", "person_created", "{}"));
    }

    @Test
    void testAppendAssignsIncreasingIds() {
        Event first = append("person_created");
        Event second = append("person_updated");

        assertTrue(second.id() > first.id());
        assertEquals("person", first.objectType());
        assertEquals("person_created", first.eventType());
        assertNotNull(first.createdAt());
    }

    @Test
    void testRolledBackAppendIsNeverVisible() {
        assertThrows(IllegalStateException.class, () -> transactionOps.executeWrite(status -> {
            eventLog.append("person", "person_created", "{}");
            throw new IllegalStateException("domain write failed");
        }));

        assertThat(eventLog.scanSince(0, 10)).isEmpty();
    }

    @Test
    void testScanSinceIsAscendingAndBounded() {
        for (int i = 0; i < 6; i++) {
            append("person_created");
        }

        List<Event> batch = eventLog.scanSince(2, 3);

        assertThat(batch).extracting(Event::id).containsExactly(3L, 4L, 5L);
        assertThat(eventLog.scanSince(6, 10)).isEmpty();
    }

    @Test
    void testDeleteUpToRemovesOnlyUpToWatermark() {
        for (int i = 0; i < 4; i++) {
            append("person_created");
        }

        assertEquals(0, eventLog.deleteUpTo(0));
        assertEquals(2, eventLog.deleteUpTo(2));

        assertThat(eventLog.scanSince(0, 10)).extracting(Event::id).containsExactly(3L, 4L);
    }

    @Test
    void testClaimAndDeleteInOneTransaction() {
        long id = append("person_created").id();

        boolean deleted = transactionOps.executeWrite(status -> {
            Optional<Event> claimed = eventLog.claimOne(id);
            assertTrue(claimed.isPresent());
            return eventLog.deleteOne(id);
        });

        assertTrue(deleted);
        assertThat(eventLog.scanSince(0, 10)).isEmpty();
    }

    @Test
    void testClaimRequiresTransaction() {
        assertThrows(IllegalStateException.class, () -> eventLog.claimOne());
        assertThrows(IllegalStateException.class, () -> eventLog.claimOne(1L));
    }

    @Test
    void testTargetedClaimFailsFastWhenHeld() throws Exception {
        long id = append("person_created").id();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<Boolean> holder = pool.submit(() -> transactionOps.executeWrite(status -> {
            boolean claimed = eventLog.claimOne(id).isPresent();
            held.countDown();
            release.await(10, TimeUnit.SECONDS);
            return claimed;
        }));
        assertTrue(held.await(10, TimeUnit.SECONDS));

        long started = System.nanoTime();
        Optional<Event> second = transactionOps.executeWrite(status -> eventLog.claimOne(id));
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertTrue(holder.get(10, TimeUnit.SECONDS));
        assertThat(second).isEmpty();
        assertThat(waitedMillis).isLessThan(1000);
        // the holder committed without deleting, so the row is still there
        assertThat(eventLog.scanSince(0, 10)).extracting(Event::id).containsExactly(id);
    }

    @Test
    void testConcurrentOpportunisticClaimsGetDistinctEvents() throws Exception {
        append("person_created");
        append("person_created");
        CyclicBarrier bothHolding = new CyclicBarrier(2);

        Future<Optional<Event>> a = pool.submit(() -> transactionOps.executeWrite(status -> {
            Optional<Event> claimed = eventLog.claimOne();
            bothHolding.await(10, TimeUnit.SECONDS);
            return claimed;
        }));
        Future<Optional<Event>> b = pool.submit(() -> transactionOps.executeWrite(status -> {
            Optional<Event> claimed = eventLog.claimOne();
            bothHolding.await(10, TimeUnit.SECONDS);
            return claimed;
        }));

        Optional<Event> first = a.get(20, TimeUnit.SECONDS);
        Optional<Event> second = b.get(20, TimeUnit.SECONDS);

        assertTrue(first.isPresent());
        assertTrue(second.isPresent());
        assertNotEquals(first.get().id(), second.get().id());
    }

    @Test
    void testOpportunisticClaimEmptyWhenAllLocked() throws Exception {
        long id = append("person_created").id();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = pool.submit(() -> transactionOps.executeWrite(status -> {
            eventLog.claimOne(id);
            held.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }));
        assertTrue(held.await(10, TimeUnit.SECONDS));

        Optional<Event> other = transactionOps.executeWrite(status -> eventLog.claimOne());
        release.countDown();
        holder.get(10, TimeUnit.SECONDS);

        assertThat(other).isEmpty();
    }
}
