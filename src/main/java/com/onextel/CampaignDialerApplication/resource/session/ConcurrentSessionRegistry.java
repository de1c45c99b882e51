package com.onextel.CampaignDialerApplication.resource.session;

import com.onextel.CampaignDialerApplication.repository.GlobalSettingsRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tracks live real-time sessions with secondary indices by user and by remote address,
 * enforcing process, user and address ceilings.
 * <p>
 * Mutations are synchronized so that the ceiling check and the insert are one step.
 * Limits are read from {@code global_settings} on first use and on {@link #refreshLimits()}.
 */
@Component
@Slf4j
public class ConcurrentSessionRegistry {
    private static final long CLOSE_ALL_TIMEOUT_SECONDS = 10;

    private final GlobalSettingsRepository settingsRepository;
    private final Clock clock;

    private final Map<String, SessionHandle> sessions = new HashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new HashMap<>();
    private final Map<String, Set<String>> sessionsByAddress = new HashMap<>();

    private SessionLimits limits;

    public ConcurrentSessionRegistry(GlobalSettingsRepository settingsRepository,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        this.settingsRepository = settingsRepository;
        this.clock = clock;
        meterRegistry.gauge("sessions.live", this, ConcurrentSessionRegistry::size);
    }

    /**
     * Registers a session. Returns {@code false}, without registering, when any ceiling would be exceeded.
     */
    public synchronized boolean addConnection(WebSocketSession session, String userId, String remoteAddress) {
        SessionLimits current = currentLimits();
        String sessionId = session.getId();
        if (sessions.containsKey(sessionId)) {
            return true;
        }
        if (sessions.size() >= current.getMaxPerProcess()) {
            log.warn("Rejecting session {}: process limit {} reached", sessionId, current.getMaxPerProcess());
            return false;
        }
        if (userId != null && indexSize(sessionsByUser, userId) >= current.getMaxPerUser()) {
            log.warn("Rejecting session {}: user {} at limit {}", sessionId, userId, current.getMaxPerUser());
            return false;
        }
        if (remoteAddress != null && indexSize(sessionsByAddress, remoteAddress) >= current.getMaxPerAddress()) {
            log.warn("Rejecting session {}: address {} at limit {}", sessionId, remoteAddress, current.getMaxPerAddress());
            return false;
        }

        sessions.put(sessionId, new SessionHandle(sessionId, userId, remoteAddress, session, clock.instant()));
        if (userId != null) {
            sessionsByUser.computeIfAbsent(userId, k -> new HashSet<>()).add(sessionId);
        }
        if (remoteAddress != null) {
            sessionsByAddress.computeIfAbsent(remoteAddress, k -> new HashSet<>()).add(sessionId);
        }
        log.debug("Session {} registered (user={}, address={}, total={})", sessionId, userId, remoteAddress, sessions.size());
        return true;
    }

    /**
     * Idempotent. Missing user or address fall back to what was stored at registration.
     */
    public synchronized boolean removeConnection(String sessionId, String userId, String remoteAddress) {
        SessionHandle handle = sessions.remove(sessionId);
        if (handle == null) {
            return false;
        }
        String effectiveUser = userId != null ? userId : handle.getUserId();
        String effectiveAddress = remoteAddress != null ? remoteAddress : handle.getRemoteAddress();
        removeFromIndex(sessionsByUser, effectiveUser, sessionId);
        removeFromIndex(sessionsByAddress, effectiveAddress, sessionId);
        // a caller-supplied value may differ from the stored one, clean both
        removeFromIndex(sessionsByUser, handle.getUserId(), sessionId);
        removeFromIndex(sessionsByAddress, handle.getRemoteAddress(), sessionId);
        return true;
    }

    public boolean removeConnection(String sessionId) {
        return removeConnection(sessionId, null, null);
    }

    public synchronized int size() {
        return sessions.size();
    }

    public synchronized int countForUser(String userId) {
        return indexSize(sessionsByUser, userId);
    }

    public synchronized int countForAddress(String remoteAddress) {
        return indexSize(sessionsByAddress, remoteAddress);
    }

    public synchronized SessionRegistryStats getStats() {
        SessionLimits current = currentLimits();
        double utilization = current.getMaxPerProcess() == 0
                ? 0.0
                : Math.round(sessions.size() * 10000.0 / current.getMaxPerProcess()) / 100.0;
        return new SessionRegistryStats(sessions.size(), sessionsByUser.size(), sessionsByAddress.size(),
                current, utilization);
    }

    public synchronized SessionLimits refreshLimits() {
        limits = loadLimits();
        log.info("Session limits refreshed: process={}, user={}, address={}",
                limits.getMaxPerProcess(), limits.getMaxPerUser(), limits.getMaxPerAddress());
        return limits;
    }

    /**
     * Closes every live session and waits for all closes to settle before clearing state.
     * The handles are snapshotted first since close callbacks remove entries concurrently.
     */
    public void closeAll(CloseStatus status) {
        List<SessionHandle> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(sessions.values());
        }
        log.info("Closing {} live sessions: {}", snapshot.size(), status.getReason());

        List<CompletableFuture<Void>> closes = snapshot.stream()
                .map(handle -> CompletableFuture.runAsync(() -> closeQuietly(handle, status)))
                .toList();
        try {
            CompletableFuture.allOf(closes.toArray(new CompletableFuture[0]))
                    .get(CLOSE_ALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing sessions");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not all sessions closed cleanly: {}", e.getMessage());
        }

        synchronized (this) {
            sessions.clear();
            sessionsByUser.clear();
            sessionsByAddress.clear();
        }
    }

    private void closeQuietly(SessionHandle handle, CloseStatus status) {
        try {
            if (handle.getSession().isOpen()) {
                handle.getSession().close(status);
            }
        } catch (IOException e) {
            log.warn("Failed to close session {}: {}", handle.getSessionId(), e.getMessage());
        }
    }

    private SessionLimits currentLimits() {
        if (limits == null) {
            limits = loadLimits();
        }
        return limits;
    }

    private SessionLimits loadLimits() {
        SessionLimits defaults = SessionLimits.DEFAULTS;
        try {
            return new SessionLimits(
                    settingsRepository.findInt(SessionLimits.MAX_PER_PROCESS_KEY).orElse(defaults.getMaxPerProcess()),
                    settingsRepository.findInt(SessionLimits.MAX_PER_USER_KEY).orElse(defaults.getMaxPerUser()),
                    settingsRepository.findInt(SessionLimits.MAX_PER_ADDRESS_KEY).orElse(defaults.getMaxPerAddress()));
        } catch (Exception e) {
            log.warn("Could not load session limits, using defaults: {}", e.getMessage());
            return defaults;
        }
    }

    private static int indexSize(Map<String, Set<String>> index, String key) {
        Set<String> ids = index.get(key);
        return ids == null ? 0 : ids.size();
    }

    private static void removeFromIndex(Map<String, Set<String>> index, String key, String sessionId) {
        if (key == null) {
            return;
        }
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(sessionId);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }
}
