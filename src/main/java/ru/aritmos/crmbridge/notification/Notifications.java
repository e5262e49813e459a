package ru.aritmos.crmbridge.notification;

import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.MessageEvent;
import ru.aritmos.crmbridge.model.Notification;
import ru.aritmos.crmbridge.model.NotificationType;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Фабрика типовых уведомлений дашборда.
 */
public final class Notifications {

    /** Максимальная длина превью текста в уведомлении. */
    public static final int PREVIEW_LENGTH = 50;

    private Notifications() {
    }

    /**
     * Исходящий автоответ, отправленный в чат.
     */
    public static Notification autoReply(MessageEvent trigger, String replyText, AgentPersona persona, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("chatId", trigger.chatId());
        data.put("inReplyTo", trigger.messageId());
        data.put("direction", "outgoing");
        data.put("body", replyText);
        data.put("preview", preview(replyText));
        data.put("agentName", persona == null ? AgentPersona.DEFAULT_AGENT_NAME : persona.agentName());
        data.put("automated", true);
        if (trigger.accountId() != null) {
            data.put("accountId", trigger.accountId());
        }
        return Notification.of(NotificationType.NEW_MESSAGE, now, data);
    }

    /**
     * Подтверждение подключения клиента (адресное, в историю не попадает).
     */
    public static Notification clientConnected(String clientId, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "connected");
        data.put("clientId", clientId);
        data.put("message", "Conectado al servidor de notificaciones");
        return Notification.of(NotificationType.CONNECTION_STATUS, now, data);
    }

    /**
     * Изменение статуса WhatsApp-аккаунта.
     *
     * @param status connected / disconnected / error
     */
    public static Notification accountStatus(long accountId, String accountName, String status, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("accountId", accountId);
        data.put("accountName", accountName);
        data.put("status", status);
        data.put("priority", "error".equals(status) ? "high" : "medium");
        return Notification.of(NotificationType.CONNECTION_STATUS, now, data);
    }

    public static Notification of(NotificationType type, Map<String, Object> data, Instant now) {
        return Notification.of(type, now, data);
    }

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("[\\r\\n\\t]", " ").trim();
        return flat.length() > PREVIEW_LENGTH ? flat.substring(0, PREVIEW_LENGTH) + "..." : flat;
    }
}
