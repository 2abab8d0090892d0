package com.example.console_relay.support;

import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket session double that records what was sent to it and how it was closed.
 */
public class RecordingWebSocketSession implements WebSocketSession {

    private final String id;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final BlockingQueue<WebSocketMessage<?>> sent = new LinkedBlockingQueue<>();
    private final CountDownLatch closed = new CountDownLatch(1);
    private final CountDownLatch sendEntered = new CountDownLatch(1);

    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile CloseStatus closeStatus;
    private volatile CountDownLatch sendGate;

    public RecordingWebSocketSession(String id) {
        this.id = id;
    }

    public RecordingWebSocketSession withAttributes(Map<String, Object> values) {
        attributes.putAll(values);
        return this;
    }

    public void failSends() {
        this.failSends = true;
    }

    /**
     * Makes every send block until {@code gate} opens, like a peer that stopped reading.
     */
    public void holdSendsUntil(CountDownLatch gate) {
        this.sendGate = gate;
    }

    public boolean awaitSendEntered(long timeoutMs) throws InterruptedException {
        return sendEntered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Simulates the peer dropping the connection without a close handshake.
     */
    public void drop() {
        open = false;
    }

    public WebSocketMessage<?> nextSent(long timeoutMs) throws InterruptedException {
        return sent.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public String nextSentText(long timeoutMs) throws InterruptedException {
        WebSocketMessage<?> message = nextSent(timeoutMs);
        return message == null ? null : payloadText(message);
    }

    public int sentCount() {
        return sent.size();
    }

    public CloseStatus awaitClose(long timeoutMs) throws InterruptedException {
        closed.await(timeoutMs, TimeUnit.MILLISECONDS);
        return closeStatus;
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }

    public static String payloadText(WebSocketMessage<?> message) {
        if (message instanceof TextMessage) {
            return ((TextMessage) message).getPayload();
        }
        ByteBuffer buffer = ((ByteBuffer) message.getPayload()).duplicate();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public URI getUri() {
        return URI.create("ws://localhost/" + id);
    }

    @Override
    public HttpHeaders getHandshakeHeaders() {
        return new HttpHeaders();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Principal getPrincipal() {
        return null;
    }

    @Override
    public InetSocketAddress getLocalAddress() {
        return new InetSocketAddress("127.0.0.1", 8080);
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return new InetSocketAddress("127.0.0.1", 50000);
    }

    @Override
    public String getAcceptedProtocol() {
        return null;
    }

    @Override
    public void setTextMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getTextMessageSizeLimit() {
        return 65536;
    }

    @Override
    public void setBinaryMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getBinaryMessageSizeLimit() {
        return 65536;
    }

    @Override
    public List<WebSocketExtension> getExtensions() {
        return Collections.emptyList();
    }

    @Override
    public void sendMessage(WebSocketMessage<?> message) throws IOException {
        if (!open) {
            throw new IOException("session " + id + " is closed");
        }
        if (failSends) {
            throw new IOException("broken pipe");
        }
        CountDownLatch gate = sendGate;
        if (gate != null) {
            sendEntered.countDown();
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("send interrupted", e);
            }
        }
        sent.add(message);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    @Override
    public synchronized void close(CloseStatus status) {
        if (closeStatus != null) {
            return;
        }
        open = false;
        closeStatus = status;
        closed.countDown();
    }
}
