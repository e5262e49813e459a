package ru.aritmos.crmbridge.notification;

import io.micronaut.websocket.WebSocketSession;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link NotificationTransport} поверх Micronaut {@link WebSocketSession}.
 * <p>
 * Запись асинхронная; хаб ждёт её завершения не дольше {@code wacrm.pipeline.socket-send-timeout}.
 */
public final class WebSocketSessionTransport implements NotificationTransport {

    private final WebSocketSession session;

    public WebSocketSessionTransport(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public CompletableFuture<Void> send(String json) {
        return session.sendAsync(json).thenApply(sent -> null);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
