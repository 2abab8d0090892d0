package com.example.console_relay.service;

import com.example.console_relay.session.ConsoleSession;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: drops long-expired tickets and closes sessions that have been
 * silent in both directions for longer than the idle timeout.
 */
@Service
@Slf4j
public class ConsoleMaintenanceService {

    static final String IDLE_REASON = "idle timeout";

    private final ConsoleTicketStore ticketStore;
    private final ConsoleSessionRegistry registry;
    private final ConsoleRelayService relayService;
    private final Clock clock;
    private final Duration idleTimeout;
    private final ScheduledExecutorService sweeper =
            Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("console-sweeper-"));

    public ConsoleMaintenanceService(ConsoleTicketStore ticketStore,
                                     ConsoleSessionRegistry registry,
                                     ConsoleRelayService relayService,
                                     Clock clock,
                                     @Value("${relay.ticket.sweep-interval:15s}") Duration sweepInterval,
                                     @Value("${relay.session.idle-timeout:0s}") Duration idleTimeout) {
        this.ticketStore = ticketStore;
        this.registry = registry;
        this.relayService = relayService;
        this.clock = clock;
        this.idleTimeout = idleTimeout;

        long intervalMs = sweepInterval.toMillis();
        sweeper.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void sweep() {
        try {
            Instant now = clock.instant();
            ticketStore.purgeExpired(now);
            closeIdleSessions(now);
        } catch (RuntimeException e) {
            // an exception would cancel the schedule
            log.error("Console maintenance sweep failed: {}", e.getMessage(), e);
        }
    }

    int closeIdleSessions(Instant now) {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            return 0;
        }
        Instant cutoff = now.minus(idleTimeout);
        int closed = 0;
        for (ConsoleSession session : registry.all()) {
            if (session.getLastActivityAt().isBefore(cutoff) && relayService.terminate(session.getId(), IDLE_REASON)) {
                log.info("[{}] Closing idle console session on {}", session.getId(), session.getResource());
                closed++;
            }
        }
        return closed;
    }

    @PreDestroy
    public void shutdown() {
        sweeper.shutdownNow();
    }
}
