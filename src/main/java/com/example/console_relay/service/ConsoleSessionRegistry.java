package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleSessionView;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.session.ConsoleSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Process-wide table of console sessions. Entries are only inserted and removed;
 * the per-session bridge never goes through here.
 * <p>
 * Two views are kept: every live session from admission until teardown, which external
 * cancellation goes through, and the sessions whose bridge is open, which is what
 * listings and idle checks see.
 */
@Service
@Slf4j
public class ConsoleSessionRegistry {

    private final Map<String, ConsoleSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ConsoleSession> live = new ConcurrentHashMap<>();
    private final AtomicInteger reservedSlots = new AtomicInteger();
    private final int maxConcurrentSessions;

    public ConsoleSessionRegistry(@Value("${relay.session.max-concurrent:200}") int maxConcurrentSessions) {
        this.maxConcurrentSessions = maxConcurrentSessions;
    }

    /**
     * Reserves room for one more session; 0 or less means unlimited.
     */
    public boolean tryReserveSlot() {
        while (true) {
            int current = reservedSlots.get();
            if (maxConcurrentSessions > 0 && current >= maxConcurrentSessions) {
                log.warn("Session ceiling reached ({}), rejecting new console session", maxConcurrentSessions);
                return false;
            }
            if (reservedSlots.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseSlot() {
        reservedSlots.decrementAndGet();
    }

    public int reservedSlots() {
        return reservedSlots.get();
    }

    /**
     * Starts tracking a session as soon as it is admitted, before it has an upstream.
     */
    public void track(ConsoleSession session) {
        live.put(session.getId(), session);
    }

    public void register(ConsoleSession session) {
        ConsoleSession previous = sessions.putIfAbsent(session.getId(), session);
        if (previous != null) {
            throw new IllegalStateException("Session id already registered: " + session.getId());
        }
        log.info("Console session registered: id={}, resource={}, operator={}",
                session.getId(), session.getResource(), session.getOperatorId());
    }

    public ConsoleSession remove(String sessionId) {
        live.remove(sessionId);
        ConsoleSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("Console session removed: id={}, resource={}", sessionId, removed.getResource());
        }
        return removed;
    }

    /**
     * Looks up a live session, whatever its state.
     */
    public Optional<ConsoleSession> find(String sessionId) {
        return Optional.ofNullable(live.get(sessionId));
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /**
     * Live sessions on one resource, including those still connecting.
     */
    public List<ConsoleSession> findByResource(ResourceDescriptor resource) {
        return live.values().stream()
                .filter(s -> s.getResource().equals(resource))
                .collect(Collectors.toList());
    }

    /**
     * Sessions whose bridge is open.
     */
    public List<ConsoleSession> all() {
        return List.copyOf(sessions.values());
    }

    public List<ConsoleSession> allLive() {
        return List.copyOf(live.values());
    }

    public int liveCount() {
        return live.size();
    }

    public List<ConsoleSessionView> views() {
        return sessions.values().stream()
                .map(ConsoleSession::toView)
                .sorted(Comparator.comparing(ConsoleSessionView::getCreatedAt))
                .collect(Collectors.toList());
    }

    public int size() {
        return sessions.size();
    }
}
