package com.onextel.CampaignDialerApplication.resource.session;

import com.onextel.CampaignDialerApplication.repository.GlobalSettingsRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConcurrentSessionRegistryTest {

    private GlobalSettingsRepository settingsRepository;
    private ConcurrentSessionRegistry registry;

    @BeforeEach
    void setUp() {
        settingsRepository = mock(GlobalSettingsRepository.class);
        when(settingsRepository.findInt(anyString())).thenReturn(Optional.empty());
        when(settingsRepository.findInt(SessionLimits.MAX_PER_PROCESS_KEY)).thenReturn(Optional.of(4));
        when(settingsRepository.findInt(SessionLimits.MAX_PER_USER_KEY)).thenReturn(Optional.of(2));
        when(settingsRepository.findInt(SessionLimits.MAX_PER_ADDRESS_KEY)).thenReturn(Optional.of(3));
        registry = new ConcurrentSessionRegistry(settingsRepository,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC),
                new SimpleMeterRegistry());
    }

    private static WebSocketSession session(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void enforcesPerUserLimit() {
        assertTrue(registry.addConnection(session("s1"), "user-1", "10.0.0.1"));
        assertTrue(registry.addConnection(session("s2"), "user-1", "10.0.0.2"));
        assertFalse(registry.addConnection(session("s3"), "user-1", "10.0.0.3"));

        assertEquals(2, registry.countForUser("user-1"));
        assertEquals(2, registry.size());
    }

    @Test
    void enforcesPerAddressAndProcessLimits() {
        assertTrue(registry.addConnection(session("s1"), null, "10.0.0.1"));
        assertTrue(registry.addConnection(session("s2"), null, "10.0.0.1"));
        assertTrue(registry.addConnection(session("s3"), null, "10.0.0.1"));
        assertFalse(registry.addConnection(session("s4"), null, "10.0.0.1"));

        assertTrue(registry.addConnection(session("s5"), null, "10.0.0.2"));
        assertFalse(registry.addConnection(session("s6"), null, "10.0.0.3"));
        assertEquals(4, registry.size());
    }

    @Test
    void removalIsIdempotentAndFreesCapacity() {
        registry.addConnection(session("s1"), "user-1", "10.0.0.1");
        registry.addConnection(session("s2"), "user-1", "10.0.0.1");

        assertTrue(registry.removeConnection("s1"));
        assertFalse(registry.removeConnection("s1"));

        assertEquals(1, registry.countForUser("user-1"));
        assertEquals(1, registry.countForAddress("10.0.0.1"));
        assertTrue(registry.addConnection(session("s3"), "user-1", "10.0.0.1"));
    }

    @Test
    void concurrentAddsNeverExceedProcessLimit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        try {
            for (int i = 0; i < 20; i++) {
                WebSocketSession session = session("s" + i);
                String address = "10.0.0." + i;
                pool.submit(() -> {
                    start.await();
                    if (registry.addConnection(session, null, address)) {
                        accepted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(4, accepted.get());
        assertEquals(4, registry.size());
    }

    @Test
    void statsReportUtilization() {
        registry.addConnection(session("s1"), "user-1", "10.0.0.1");
        registry.addConnection(session("s2"), "user-2", "10.0.0.1");

        SessionRegistryStats stats = registry.getStats();

        assertEquals(2, stats.getTotalConnections());
        assertEquals(2, stats.getUniqueUsers());
        assertEquals(1, stats.getUniqueAddresses());
        assertEquals(50.0, stats.getUtilizationPercent());
    }

    @Test
    void refreshLimitsRereadsSettings() {
        assertEquals(2, registry.getStats().getLimits().getMaxPerUser());

        when(settingsRepository.findInt(SessionLimits.MAX_PER_USER_KEY)).thenReturn(Optional.of(7));

        assertEquals(7, registry.refreshLimits().getMaxPerUser());
    }

    @Test
    void unreadableSettingsFallBackToDefaults() {
        when(settingsRepository.findInt(anyString())).thenThrow(new IllegalStateException("db down"));

        assertEquals(SessionLimits.DEFAULTS, registry.refreshLimits());
    }

    @Test
    void closeAllClosesOpenSessionsAndClearsState() throws Exception {
        WebSocketSession open = session("s1");
        WebSocketSession closed = session("s2");
        when(closed.isOpen()).thenReturn(false);
        registry.addConnection(open, "user-1", "10.0.0.1");
        registry.addConnection(closed, "user-2", "10.0.0.2");

        registry.closeAll(CloseStatus.GOING_AWAY);

        verify(open).close(CloseStatus.GOING_AWAY);
        verify(closed, never()).close(CloseStatus.GOING_AWAY);
        assertEquals(0, registry.size());
        assertEquals(0, registry.countForUser("user-1"));
    }
}
