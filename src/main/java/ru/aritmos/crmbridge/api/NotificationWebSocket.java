package ru.aritmos.crmbridge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.websocket.WebSocketSession;
import io.micronaut.websocket.annotation.OnClose;
import io.micronaut.websocket.annotation.OnError;
import io.micronaut.websocket.annotation.OnMessage;
import io.micronaut.websocket.annotation.OnOpen;
import io.micronaut.websocket.annotation.ServerWebSocket;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.core.SensitiveDataSanitizer;
import ru.aritmos.crmbridge.notification.NotificationHub;
import ru.aritmos.crmbridge.notification.Notifications;
import ru.aritmos.crmbridge.notification.WebSocketSessionTransport;

import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * WebSocket endpoint уведомлений дашборда.
 * <p>
 * Каждая сессия регистрируется в {@link NotificationHub} под своим id и удаляется при закрытии или ошибке.
 * Регистрация (с отправкой истории) выполняется в IO executor, чтобы ожидание записи кадров
 * не блокировало websocket event-loop.
 * <p>
 * Входящие кадры клиента: {@code {"type":"subscribe"}} (только лог) и {@code {"type":"ping"}}
 * (ответ адресным CONNECTION_STATUS).
 */
@ServerWebSocket("/ws/notifications")
public class NotificationWebSocket {

    private static final Logger log = LoggerFactory.getLogger(NotificationWebSocket.class);

    private final NotificationHub hub;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService executor;

    public NotificationWebSocket(NotificationHub hub,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 @Named(TaskExecutors.IO) ExecutorService executor) {
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.executor = executor;
    }

    @OnOpen
    void onOpen(WebSocketSession session) {
        String clientId = session.getId();
        executor.submit(() -> {
            try {
                hub.register(clientId, new WebSocketSessionTransport(session));
            } catch (Exception e) {
                log.warn("Не удалось зарегистрировать клиента уведомлений {}: {}", clientId, SensitiveDataSanitizer.describe(e));
            }
        });
    }

    @OnMessage
    void onMessage(String message, WebSocketSession session) {
        String type;
        try {
            JsonNode node = objectMapper.readTree(message);
            type = node.path("type").asText("");
        } catch (Exception e) {
            log.debug("Некорректный кадр от клиента {}: {}", session.getId(), SensitiveDataSanitizer.describe(e));
            return;
        }

        if ("subscribe".equals(type)) {
            log.info("Клиент {} подписан на уведомления", session.getId());
        } else if ("ping".equals(type)) {
            String clientId = session.getId();
            executor.submit(() -> hub.sendTo(clientId, Notifications.clientConnected(clientId, clock.instant())));
        }
    }

    @OnClose
    void onClose(WebSocketSession session) {
        hub.remove(session.getId());
    }

    @OnError
    void onError(WebSocketSession session, Throwable error) {
        log.warn("Ошибка WebSocket клиента {}: {}", session.getId(), SensitiveDataSanitizer.describe(error));
        hub.remove(session.getId());
    }
}
