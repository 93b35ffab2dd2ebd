package com.camingest.camingest.service.websocket;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.camingest.camingest.model.dto.CameraEvent;
import com.camingest.camingest.service.events.EventSink;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Live dashboards connect to {@code /events} and receive every camera event as JSON.
 * A session that fails to receive a message is closed and forgotten.
 */
@Component
public class DashboardEventSocketHandler extends TextWebSocketHandler implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(DashboardEventSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Set<WebSocketSession> sessions = ConcurrentHashMap.newKeySet();

    public DashboardEventSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        logger.info("Dashboard client connected: {} ({} open)", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        logger.info("Dashboard client disconnected: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Dashboard transport error on {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    @Override
    public String getName() {
        return "dashboard";
    }

    @Override
    public void deliver(String channel, CameraEvent event) throws IOException {
        if (sessions.isEmpty()) {
            return;
        }
        TextMessage message = new TextMessage(objectMapper.writeValueAsString(event));
        for (WebSocketSession session : sessions) {
            try {
                // Sessions are not safe for concurrent sends
                synchronized (session) {
                    session.sendMessage(message);
                }
            } catch (IOException | IllegalStateException e) {
                logger.debug("Dropping dashboard session {}: {}", session.getId(), e.getMessage());
                sessions.remove(session);
                closeQuietly(session);
            }
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            logger.debug("Error closing session {}: {}", session.getId(), e.getMessage());
        }
    }
}
