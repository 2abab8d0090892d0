package com.example.console_relay.session;

import com.example.console_relay.dto.ConsoleSessionView;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One operator terminal bridged to one upstream console.
 * <p>
 * State changes happen on the relay task that owns the session. Other threads (the two
 * container threads delivering frames, admin and shutdown callers) only forward frames and
 * {@link #signal(SessionOutcome) signal} termination; the first signal wins.
 * <p>
 * Frames that arrive before {@link ConsoleSessionState#OPEN} are queued per direction and
 * flushed, in order, when the bridge opens. Once a direction is flushed its frames go
 * straight to the decorated peer session, which serializes concurrent sends and enforces
 * the send time and buffer limits. No lock is held across a send, so a stuck write never
 * keeps teardown from closing both connections.
 */
@Slf4j
public class ConsoleSession {

    @Getter
    private final String id = UUID.randomUUID().toString();
    @Getter
    private final ResourceDescriptor resource;
    @Getter
    private final Instant createdAt;
    private final WebSocketSession client;
    private final Clock clock;
    private final int pendingFrameLimit;
    private final int sendTimeLimitMs;
    private final int sendBufferLimit;

    private final AtomicReference<ConsoleSessionState> state = new AtomicReference<>(ConsoleSessionState.ADMITTED);
    private final CompletableFuture<SessionOutcome> termination = new CompletableFuture<>();
    private final AtomicBoolean slotHeld = new AtomicBoolean();
    private final AtomicReference<Future<?>> pendingConnect = new AtomicReference<>();

    private final Direction toUpstream = new Direction("upstream");
    private final Direction toClient = new Direction("client");

    private volatile WebSocketSession upstream;
    private volatile Long operatorId;
    private volatile Instant lastActivityAt;

    public ConsoleSession(WebSocketSession client, ResourceDescriptor resource, Clock clock,
                          int pendingFrameLimit, int sendTimeLimitMs, int sendBufferLimit) {
        this.client = new ConcurrentWebSocketSessionDecorator(client, sendTimeLimitMs, sendBufferLimit);
        this.resource = resource;
        this.clock = clock;
        this.pendingFrameLimit = pendingFrameLimit;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimit = sendBufferLimit;
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
    }

    public ConsoleSessionState getState() {
        return state.get();
    }

    public Long getOperatorId() {
        return operatorId;
    }

    public void setOperatorId(Long operatorId) {
        this.operatorId = operatorId;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public WebSocketSession getUpstream() {
        return upstream;
    }

    // ============= TRANSITIONS (owning relay task) =============

    /**
     * ADMITTED to CONNECTING. Returns false when termination was already signalled.
     */
    public boolean beginConnecting() {
        return !termination.isDone()
                && state.compareAndSet(ConsoleSessionState.ADMITTED, ConsoleSessionState.CONNECTING);
    }

    /**
     * Remembers the in-flight upstream connect so a termination signal can cancel it.
     */
    public void trackConnect(Future<?> connect) {
        pendingConnect.set(connect);
        if (termination.isDone()) {
            connect.cancel(true);
        }
    }

    /**
     * Called from the upstream handler as soon as the console connection exists, so
     * teardown can always reach it.
     */
    public void attachUpstream(WebSocketSession upstream) {
        this.upstream = new ConcurrentWebSocketSessionDecorator(upstream, sendTimeLimitMs, sendBufferLimit);
    }

    /**
     * CONNECTING to OPEN, flushing frames queued while connecting.
     *
     * @return false if the session was terminated before the bridge could open
     */
    public boolean open() {
        if (termination.isDone() || upstream == null
                || !state.compareAndSet(ConsoleSessionState.CONNECTING, ConsoleSessionState.OPEN)) {
            return false;
        }
        toUpstream.flush();
        toClient.flush();
        return true;
    }

    public void markClosing() {
        ConsoleSessionState current = state.get();
        while (!current.isTerminal() && current != ConsoleSessionState.CLOSING) {
            if (state.compareAndSet(current, ConsoleSessionState.CLOSING)) {
                return;
            }
            current = state.get();
        }
    }

    /**
     * Closes both connections, then drops whatever is still queued. Upstream first, so the
     * console stops producing output nobody will read.
     */
    public void closeConnections(SessionOutcome outcome) {
        closeQuietly(upstream, outcome.getUpstreamStatus(), "upstream");
        closeQuietly(client, outcome.getClientStatus(), "client");
        toUpstream.clear();
        toClient.clear();
    }

    public void markFinished(SessionOutcome outcome) {
        state.set(outcome.isErrored() ? ConsoleSessionState.ERRORED : ConsoleSessionState.CLOSED);
    }

    // ============= TERMINATION SIGNAL (any thread) =============

    /**
     * Requests teardown. Only the first outcome is kept.
     */
    public boolean signal(SessionOutcome outcome) {
        boolean first = termination.complete(outcome);
        if (first) {
            log.debug("[{}] Termination signalled: {}", id, outcome);
            Future<?> connect = pendingConnect.get();
            if (connect != null && !connect.isDone()) {
                connect.cancel(true);
            }
        }
        return first;
    }

    public boolean isTerminationRequested() {
        return termination.isDone();
    }

    public SessionOutcome awaitTermination() throws InterruptedException {
        try {
            return termination.get();
        } catch (ExecutionException e) {
            // termination is only ever completed normally
            throw new IllegalStateException(e);
        }
    }

    /**
     * The recorded outcome; only valid once termination was signalled.
     */
    public SessionOutcome currentOutcome() {
        return termination.join();
    }

    // ============= BRIDGE =============

    public void forwardFromClient(WebSocketMessage<?> message) {
        touch();
        toUpstream.forward(message);
    }

    public void forwardFromUpstream(WebSocketMessage<?> message) {
        touch();
        toClient.forward(message);
    }

    /**
     * One forwarding direction. Its lock only guards the pending queue and the flushed
     * flag; sends happen outside it.
     */
    private final class Direction {

        private final String side;
        private final Object lock = new Object();
        private final Deque<WebSocketMessage<?>> pending = new ArrayDeque<>();
        private boolean flushed;

        Direction(String side) {
            this.side = side;
        }

        private WebSocketSession target() {
            return "client".equals(side) ? client : upstream;
        }

        void forward(WebSocketMessage<?> message) {
            if (termination.isDone()) {
                return;
            }
            WebSocketMessage<?> frame = copyOf(message);
            synchronized (lock) {
                if (!flushed) {
                    if (pending.size() >= pendingFrameLimit) {
                        signal(SessionOutcome.failed(new ConsoleRelayException(RelayFailure.BAD_REQUEST,
                                "too many frames before the console was ready")));
                        return;
                    }
                    pending.addLast(frame);
                    return;
                }
            }
            if (state.get() == ConsoleSessionState.OPEN && !termination.isDone()) {
                send(target(), frame, side);
            }
        }

        /**
         * Sends queued frames in order. Frames arriving meanwhile join the queue, so the
         * direction only switches to direct sends once the queue is empty.
         */
        void flush() {
            WebSocketSession target = target();
            while (true) {
                WebSocketMessage<?> next;
                synchronized (lock) {
                    next = pending.pollFirst();
                    if (next == null) {
                        flushed = true;
                        return;
                    }
                }
                if (termination.isDone()) {
                    clear();
                    return;
                }
                send(target, next, side);
            }
        }

        void clear() {
            synchronized (lock) {
                pending.clear();
            }
        }
    }

    private void send(WebSocketSession target, WebSocketMessage<?> message, String side) {
        try {
            target.sendMessage(message);
        } catch (Exception e) {
            log.debug("[{}] Write to {} failed: {}", id, side, e.getMessage());
            signal("client".equals(side)
                    ? SessionOutcome.clientFailed(e)
                    : SessionOutcome.upstreamFailed(e));
        }
    }

    private void closeQuietly(WebSocketSession target, CloseStatus status, String side) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close(status);
        } catch (Exception e) {
            log.debug("[{}] Error closing {} connection: {}", id, side, e.getMessage());
        }
    }

    private void touch() {
        lastActivityAt = clock.instant();
    }

    /**
     * The container may recycle the buffer behind a binary frame once its callback
     * returns, so binary payloads are copied before they are queued or sent.
     */
    static WebSocketMessage<?> copyOf(WebSocketMessage<?> message) {
        if (message instanceof BinaryMessage) {
            ByteBuffer source = ((BinaryMessage) message).getPayload().duplicate();
            byte[] bytes = new byte[source.remaining()];
            source.get(bytes);
            return new BinaryMessage(bytes, message.isLast());
        }
        if (message instanceof TextMessage) {
            return message;
        }
        throw new IllegalArgumentException("Unsupported frame type: " + message.getClass().getSimpleName());
    }

    // ============= ADMISSION SLOT =============

    public void markSlotHeld() {
        slotHeld.set(true);
    }

    /**
     * @return true exactly once if a slot was held
     */
    public boolean releaseSlot() {
        return slotHeld.compareAndSet(true, false);
    }

    public ConsoleSessionView toView() {
        return ConsoleSessionView.builder()
                .id(id)
                .node(resource.getNode())
                .resourceKind(resource.getKind().getWireName())
                .resourceId(resource.getResourceId())
                .operatorId(operatorId)
                .state(state.get())
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .build();
    }

    @Override
    public String toString() {
        return "ConsoleSession(" + id + ", " + resource + ", " + state.get() + ")";
    }
}
