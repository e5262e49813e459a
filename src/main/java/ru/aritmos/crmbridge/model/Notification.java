package ru.aritmos.crmbridge.model;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Уведомление дашборда. Неизменяемо; порядок определяется порядком публикации.
 */
@Serdeable
@Introspected
@Schema(name = "Notification", description = "Уведомление для клиентов дашборда")
public record Notification(
        @Schema(description = "Идентификатор уведомления") String id,
        @Schema(description = "Тип уведомления") NotificationType type,
        @Schema(description = "Время создания") Instant timestamp,
        @Schema(description = "Произвольные данные уведомления") Map<String, Object> data
) {

    public Notification {
        Objects.requireNonNull(type, "type");
        id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Notification of(NotificationType type, Instant timestamp, Map<String, Object> data) {
        return new Notification(null, type, timestamp, data);
    }
}
