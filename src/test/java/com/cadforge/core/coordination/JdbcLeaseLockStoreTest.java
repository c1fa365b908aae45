package com.cadforge.core.coordination;

import com.cadforge.core.error.AlreadyLockedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcLeaseLockStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(30);

    private JdbcLeaseLockStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new DriverManagerDataSource("jdbc:h2:mem:locks-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcLeaseLockStore(dataSource);
        store.createTables();
    }

    @Test
    @DisplayName("a live lease blocks another holder")
    void exclusive() {
        store.acquire("sketch", "s1", "agent-a", null, T0, TTL);

        var ex = assertThrows(AlreadyLockedException.class,
                () -> store.acquire("sketch", "s1", "agent-b", null, T0.plusSeconds(10), TTL));
        assertEquals("agent-a", ex.heldLock().holderId());
    }

    @Test
    @DisplayName("an expired lease can be taken over")
    void takeOverExpired() {
        store.acquire("sketch", "s1", "agent-a", null, T0, TTL);

        var lock = store.acquire("sketch", "s1", "agent-b", "sess", T0.plusSeconds(31), TTL);

        assertEquals("agent-b", lock.holderId());
        assertEquals(T0.plusSeconds(31), lock.acquiredAt());
        assertEquals("agent-b", store.find("sketch", "s1", T0.plusSeconds(32)).orElseThrow().holderId());
    }

    @Test
    @DisplayName("renewal extends the lease and keeps the acquisition time")
    void renew() {
        store.acquire("sketch", "s1", "agent-a", null, T0, TTL);

        var renewed = store.acquire("sketch", "s1", "agent-a", null, T0.plusSeconds(20), TTL);

        assertEquals(T0, renewed.acquiredAt());
        assertEquals(T0.plusSeconds(50), renewed.expiresAt());
    }

    @Test
    @DisplayName("release only removes the holder's own lease")
    void release() {
        store.acquire("sketch", "s1", "agent-a", null, T0, TTL);

        assertFalse(store.release("sketch", "s1", "agent-b"));
        assertTrue(store.release("sketch", "s1", "agent-a"));
        assertTrue(store.find("sketch", "s1", T0).isEmpty());
    }

    @Test
    @DisplayName("list and purge see only live leases")
    void listAndPurge() {
        store.acquire("sketch", "s1", "agent-a", null, T0, TTL);
        store.acquire("sketch", "s2", "agent-a", null, T0, Duration.ofSeconds(120));

        assertEquals(1, store.list(T0.plusSeconds(60)).size());
        assertEquals(1, store.purgeExpired(T0.plusSeconds(60)));
        assertTrue(store.isAvailable());
    }
}
