package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleSessionEvent;
import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.example.console_relay.handler.RelayRequest;
import com.example.console_relay.handler.UpstreamConsoleHandler;
import com.example.console_relay.session.ConsoleSession;
import com.example.console_relay.session.SessionOutcome;
import com.example.console_relay.socket.UpstreamConsoleConnector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives every console session through
 * {@code ADMITTED -> CONNECTING -> OPEN -> CLOSING -> CLOSED | ERRORED}.
 * <p>
 * Each session runs as one task on the relay executor: admission, ticket claim, upstream
 * connect and handshake, then a wait for the termination signal, then teardown. Teardown
 * removes the registry entry before either connection is closed.
 */
@Service
@Slf4j
public class ConsoleRelayService {

    private final ConsoleSessionRegistry registry;
    private final ConsoleTicketStore ticketStore;
    private final OperatorIdentityService identityService;
    private final AdmissionGate admissionGate;
    private final UpstreamConsoleConnector connector;
    private final TicketExchangeService ticketExchangeService;
    private final ConsoleSessionEventPublisher eventPublisher;
    private final ExecutorService relayExecutor;
    private final Clock clock;

    @Value("${relay.upstream.connect-timeout:5s}")
    private Duration connectTimeout = Duration.ofSeconds(5);

    @Value("${relay.upstream.handshake-timeout:5s}")
    private Duration handshakeTimeout = Duration.ofSeconds(5);

    @Value("${relay.session.send-time-limit:10s}")
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    @Value("${relay.session.send-buffer-limit:524288}")
    private int sendBufferLimit = 512 * 1024;

    @Value("${relay.session.pending-frame-limit:256}")
    private int pendingFrameLimit = 256;

    public ConsoleRelayService(ConsoleSessionRegistry registry,
                               ConsoleTicketStore ticketStore,
                               OperatorIdentityService identityService,
                               AdmissionGate admissionGate,
                               UpstreamConsoleConnector connector,
                               TicketExchangeService ticketExchangeService,
                               ConsoleSessionEventPublisher eventPublisher,
                               @Qualifier("relayExecutor") ExecutorService relayExecutor,
                               Clock clock) {
        this.registry = registry;
        this.ticketStore = ticketStore;
        this.identityService = identityService;
        this.admissionGate = admissionGate;
        this.connector = connector;
        this.ticketExchangeService = ticketExchangeService;
        this.eventPublisher = eventPublisher;
        this.relayExecutor = relayExecutor;
        this.clock = clock;
    }

    /**
     * Accepts a freshly upgraded operator connection and starts its relay task.
     */
    public ConsoleSession start(WebSocketSession client, RelayRequest request) {
        ConsoleSession session = new ConsoleSession(client, request.getResource(), clock,
                pendingFrameLimit, (int) sendTimeLimit.toMillis(), sendBufferLimit);
        registry.track(session);
        log.info("[{}] Console session admitted: resource={}, client={}", session.getId(), request.getResource(),
                client.getRemoteAddress());
        try {
            relayExecutor.execute(() -> run(session, request));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Relay executor rejected session: {}", session.getId(), e.getMessage());
            session.signal(SessionOutcome.terminated("relay shutting down"));
            teardown(session, session.currentOutcome());
        }
        return session;
    }

    void run(ConsoleSession session, RelayRequest request) {
        try {
            establish(session, request);
        } catch (ConsoleRelayException e) {
            if (session.isTerminationRequested()) {
                log.debug("[{}] Connect abandoned after termination: {}", session.getId(), e.getMessage());
            } else {
                logFailure(session, e);
                session.signal(SessionOutcome.failed(e));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.signal(SessionOutcome.terminated("relay shutting down"));
        } catch (RuntimeException e) {
            log.error("[{}] Internal error while connecting {}: {}", session.getId(), session.getResource(),
                    e.getMessage(), e);
            session.signal(SessionOutcome.failed(
                    new ConsoleRelayException(RelayFailure.INTERNAL_ERROR, "relay failure", e)));
        }

        SessionOutcome outcome;
        try {
            outcome = session.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.signal(SessionOutcome.terminated("relay shutting down"));
            outcome = session.currentOutcome();
        }
        teardown(session, outcome);
    }

    private void establish(ConsoleSession session, RelayRequest request) throws InterruptedException {
        ResourceDescriptor resource = request.getResource();

        if (!registry.tryReserveSlot()) {
            throw new ConsoleRelayException(RelayFailure.SESSION_LIMIT_EXCEEDED, "too many open consoles");
        }
        session.markSlotHeld();

        OperatorIdentity operator = identityService.resolve(request.getToken());
        session.setOperatorId(operator.getId());
        admissionGate.admit(operator, resource);

        if (!session.beginConnecting()) {
            return;
        }
        ConsoleTicket ticket = ticketStore.claim(request.getTicket(), resource, operator.getId(),
                request.getPort(), clock.instant());
        log.info("[{}] Connecting to console of {} for operator {}", session.getId(), resource, operator.getId());

        UpstreamConsoleHandler upstreamHandler =
                new UpstreamConsoleHandler(session, ticket, ticketExchangeService.getProtocol());
        CompletableFuture<WebSocketSession> connect = connector.connect(ticket, upstreamHandler);
        session.trackConnect(connect);

        await(connect, connectTimeout, "connect");
        if (session.isTerminationRequested()) {
            return;
        }
        session.trackConnect(upstreamHandler.handshake());
        await(upstreamHandler.handshake(), handshakeTimeout, "handshake");

        registry.register(session);
        if (!session.open()) {
            log.info("[{}] Session ended before the bridge opened", session.getId());
            return;
        }
        log.info("[{}] Console bridge open: resource={}, operator={}", session.getId(), resource, operator.getId());
        publish(session, ConsoleSessionEvent.Type.OPENED, null, null);
    }

    private <T> T await(CompletableFuture<T> future, Duration timeout, String step) throws InterruptedException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                    "console " + step + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            // termination was signalled while waiting; the outcome is already recorded
            throw new ConsoleRelayException(RelayFailure.INTERNAL_ERROR, "console " + step + " cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConsoleRelayException) {
                throw (ConsoleRelayException) cause;
            }
            throw new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "console " + step + " failed", cause);
        }
    }

    void teardown(ConsoleSession session, SessionOutcome outcome) {
        session.markClosing();
        registry.remove(session.getId());
        session.closeConnections(outcome);
        if (session.releaseSlot()) {
            registry.releaseSlot();
        }
        session.markFinished(outcome);

        if (outcome.isErrored()) {
            log.warn("[{}] Console session errored: resource={}, reason={}", session.getId(),
                    session.getResource(), outcome);
        } else {
            log.info("[{}] Console session closed: resource={}, reason={}", session.getId(),
                    session.getResource(), outcome);
        }
        publish(session, outcome.isErrored() ? ConsoleSessionEvent.Type.ERRORED : ConsoleSessionEvent.Type.CLOSED,
                outcome.getClientStatus().getCode(), outcome.toString());
    }

    private void logFailure(ConsoleSession session, ConsoleRelayException e) {
        if (e.getFailure() == RelayFailure.INTERNAL_ERROR) {
            log.error("[{}] Internal error for {}: {}", session.getId(), session.getResource(), e.getMessage(), e);
        } else {
            log.info("[{}] Console session for {} refused: {} ({})", session.getId(), session.getResource(),
                    e.getFailure(), e.getMessage());
        }
    }

    private void publish(ConsoleSession session, ConsoleSessionEvent.Type type, Integer closeCode, String reason) {
        ResourceDescriptor resource = session.getResource();
        try {
            eventPublisher.publish(ConsoleSessionEvent.builder()
                    .sessionId(session.getId())
                    .type(type)
                    .node(resource.getNode())
                    .resourceKind(resource.getKind().getWireName())
                    .resourceId(resource.getResourceId())
                    .operatorId(session.getOperatorId())
                    .closeCode(closeCode)
                    .reason(reason)
                    .timestamp(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[{}] Could not publish {} event: {}", session.getId(), type, e.getMessage());
        }
    }

    // ============= EXTERNAL CANCELLATION =============

    public boolean terminate(String sessionId, String reason) {
        return registry.find(sessionId)
                .map(s -> s.signal(SessionOutcome.terminated(reason)))
                .orElse(false);
    }

    public int terminateResource(ResourceDescriptor resource, String reason) {
        List<ConsoleSession> sessions = registry.findByResource(resource);
        sessions.forEach(s -> s.signal(SessionOutcome.terminated(reason)));
        if (!sessions.isEmpty()) {
            log.info("Terminated {} console session(s) on {}: {}", sessions.size(), resource, reason);
        }
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        List<ConsoleSession> sessions = registry.allLive();
        log.info("Shutting down console relay, closing {} session(s)", sessions.size());
        sessions.forEach(s -> s.signal(SessionOutcome.terminated("server shutting down")));
        relayExecutor.shutdown();
        try {
            if (!relayExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                relayExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            relayExecutor.shutdownNow();
        }
    }
}
