package org.learningjava.flowc.infrastructure.adapter.in.web.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.flowc.application.port.BroadcastPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of open sessions. Each session is wrapped so sends from several compile threads
 * are serialized per session.
 */
@Component
public class WebSocketBroadcaster implements BroadcastPort {

    private static final Logger log = LoggerFactory.getLogger(WebSocketBroadcaster.class);

    private final ObjectMapper mapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketBroadcaster(ObjectMapper mapper,
                                @Value("${flowc.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                @Value("${flowc.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.mapper = mapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    public WebSocketSession register(WebSocketSession session) {
        WebSocketSession decorated =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        sessions.put(session.getId(), decorated);
        return decorated;
    }

    public void unregister(WebSocketSession session) {
        sessions.remove(session.getId());
    }

    /** Send to one session; the session is dropped if the send fails. */
    public void send(WebSocketSession session, Object message) {
        TextMessage frame = toFrame(message);
        WebSocketSession target = sessions.getOrDefault(session.getId(), session);
        deliver(target, frame);
    }

    @Override
    public void broadcast(Object message) {
        TextMessage frame = toFrame(message);
        for (WebSocketSession session : sessions.values()) {
            deliver(session, frame);
        }
    }

    @Override
    public int subscribers() {
        return sessions.size();
    }

    // ---------- helpers ----------

    private TextMessage toFrame(Object message) {
        if (message instanceof String s) {
            return new TextMessage(s);
        }
        try {
            return new TextMessage(mapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize broadcast message", e);
        }
    }

    private void deliver(WebSocketSession session, TextMessage frame) {
        if (!session.isOpen()) {
            sessions.remove(session.getId());
            return;
        }
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("[ws {}] send failed, dropping session: {}", session.getId(), e.toString());
            sessions.remove(session.getId());
        }
    }
}
