package ru.aritmos.crmbridge.model;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Нормализованное входящее событие WhatsApp.
 * <p>
 * Любой путь доставки (callback драйвера, повторная отправка, несколько аккаунтов) обязан приводить вход
 * к данному контракту. Идентичность события — пара {@code (chatId, messageId)}; после получения событие
 * не изменяется.
 */
@Serdeable
@Introspected
@Schema(name = "MessageEvent", description = "Входящее сообщение WhatsApp")
public record MessageEvent(
        @Schema(description = "Идентификатор чата (например, 5491122334455@c.us)", requiredMode = Schema.RequiredMode.REQUIRED)
        String chatId,

        @Schema(description = "Идентификатор сообщения, назначенный WhatsApp", requiredMode = Schema.RequiredMode.REQUIRED)
        String messageId,

        @Schema(description = "Текст сообщения")
        String body,

        @Schema(description = "true, если сообщение написал собеседник, а не наш аккаунт")
        boolean fromUser,

        @Schema(description = "Время сообщения, секунды Unix epoch")
        long timestampEpochSeconds,

        @Schema(description = "Аккаунт WhatsApp, получивший сообщение (если их несколько)")
        Long accountId,

        @Schema(description = "Отображаемое имя отправителя")
        String senderName
) {

    public MessageEvent(String chatId, String messageId, String body, boolean fromUser, long timestampEpochSeconds) {
        this(chatId, messageId, body, fromUser, timestampEpochSeconds, null, null);
    }

    /**
     * Короткое превью текста для логов и уведомлений.
     *
     * @param maxLen максимальная длина
     * @return превью (без переводов строк) или пустая строка
     */
    public String preview(int maxLen) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("[\\r\\n\\t]", " ").trim();
        if (flat.length() <= maxLen) {
            return flat;
        }
        return flat.substring(0, maxLen) + "...";
    }
}
