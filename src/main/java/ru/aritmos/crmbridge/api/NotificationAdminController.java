package ru.aritmos.crmbridge.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.crmbridge.model.Notification;
import ru.aritmos.crmbridge.model.NotificationType;
import ru.aritmos.crmbridge.notification.NotificationHub;
import ru.aritmos.crmbridge.notification.Notifications;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * API уведомлений: история и публикация событий от других частей CRM (статус аккаунтов, рассылки, алерты).
 */
@Controller("/api/notifications")
@Tag(name = "WhatsApp CRM Bridge — уведомления", description = "История и публикация уведомлений дашборда")
public class NotificationAdminController {

    private final NotificationHub hub;
    private final Clock clock;

    public NotificationAdminController(NotificationHub hub, Clock clock) {
        this.hub = hub;
        this.clock = clock;
    }

    @Get(uri = "/history")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Последние уведомления, от старых к новым")
    public List<Notification> history() {
        return hub.history();
    }

    @Post(uri = "/broadcast", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Разослать уведомление всем клиентам дашборда")
    public HttpResponse<PublishResult> broadcast(@Body PublishRequest request) {
        if (request == null || request.type() == null) {
            return HttpResponse.badRequest(new PublishResult(null, 0, "Не задан type"));
        }
        Notification n = Notifications.of(request.type(), request.data(), clock.instant());
        int delivered = hub.broadcast(n);
        return HttpResponse.ok(new PublishResult(n.id(), delivered, null));
    }

    @Post(uri = "/account-status", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Сообщить об изменении статуса WhatsApp-аккаунта")
    public HttpResponse<PublishResult> accountStatus(@Body AccountStatusRequest request) {
        if (request == null || request.accountId() == null || request.status() == null || request.status().isBlank()) {
            return HttpResponse.badRequest(new PublishResult(null, 0, "Не заданы accountId или status"));
        }
        Notification n = Notifications.accountStatus(request.accountId(), request.accountName(), request.status().trim(), clock.instant());
        int delivered = hub.broadcast(n);
        return HttpResponse.ok(new PublishResult(n.id(), delivered, null));
    }

    @Serdeable
    @Schema(name = "NotificationPublishRequest", description = "Уведомление для рассылки")
    public record PublishRequest(
            @Schema(description = "Тип уведомления", requiredMode = Schema.RequiredMode.REQUIRED) NotificationType type,
            @Schema(description = "Данные уведомления") Map<String, Object> data
    ) {
    }

    @Serdeable
    @Schema(name = "AccountStatusRequest", description = "Статус WhatsApp-аккаунта")
    public record AccountStatusRequest(
            @Schema(description = "Идентификатор аккаунта", requiredMode = Schema.RequiredMode.REQUIRED) Long accountId,
            @Schema(description = "Имя аккаунта") String accountName,
            @Schema(description = "connected / disconnected / error", requiredMode = Schema.RequiredMode.REQUIRED) String status
    ) {
    }

    @Serdeable
    @Schema(name = "NotificationPublishResult", description = "Результат рассылки")
    public record PublishResult(
            @Schema(description = "Идентификатор уведомления") String id,
            @Schema(description = "Клиентов, получивших уведомление") int delivered,
            @Schema(description = "Ошибка") String error
    ) {
    }
}
