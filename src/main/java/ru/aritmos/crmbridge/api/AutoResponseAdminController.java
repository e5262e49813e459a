package ru.aritmos.crmbridge.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.crmbridge.core.DedupLedger;
import ru.aritmos.crmbridge.core.InboundPipelineService;
import ru.aritmos.crmbridge.core.LivenessRegistry;
import ru.aritmos.crmbridge.core.SensitiveDataSanitizer;
import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.ChatLiveness;
import ru.aritmos.crmbridge.notification.NotificationHub;

import java.util.List;
import java.util.Map;

/**
 * Admin API: управление автоответами по чатам и обслуживание состояния конвейера.
 */
@Controller("/api/auto-response")
@Tag(name = "WhatsApp CRM Bridge — Admin API (автоответы)", description = "Включение автоответов по чатам, статистика и очистка")
public class AutoResponseAdminController {

    private final LivenessRegistry livenessRegistry;
    private final DedupLedger ledger;
    private final NotificationHub notificationHub;
    private final InboundPipelineService pipeline;

    public AutoResponseAdminController(LivenessRegistry livenessRegistry,
                                       DedupLedger ledger,
                                       NotificationHub notificationHub,
                                       InboundPipelineService pipeline) {
        this.livenessRegistry = livenessRegistry;
        this.ledger = ledger;
        this.notificationHub = notificationHub;
        this.pipeline = pipeline;
    }

    @Post(uri = "/chats/{chatId}/toggle")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Включить или выключить автоответы в чате",
            description = "Переключение не обрабатывает задним числом сообщения, пришедшие в выключенном состоянии.")
    @ApiResponse(responseCode = "200", description = "Новое состояние чата", content = @Content(schema = @Schema(implementation = ChatLiveness.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный запрос")
    public HttpResponse<?> toggle(@Parameter(description = "Идентификатор чата") @PathVariable String chatId,
                                  @Body ToggleRequest request) {
        try {
            if (request == null || request.active() == null) {
                throw new IllegalArgumentException("Не задано поле active");
            }
            AgentPersona persona = (request.agentName() == null && request.agentUrl() == null)
                    ? null
                    : new AgentPersona(request.agentName(), request.agentUrl());
            return HttpResponse.ok(livenessRegistry.configure(chatId, request.active(), persona));
        } catch (IllegalArgumentException ex) {
            return HttpResponse.badRequest(Map.of("error", "BAD_REQUEST",
                    "message", SensitiveDataSanitizer.sanitizeText(ex.getMessage())));
        }
    }

    @Get(uri = "/chats/{chatId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Состояние автоответов чата")
    @ApiResponse(responseCode = "200", description = "Состояние чата", content = @Content(schema = @Schema(implementation = ChatLiveness.class)))
    @ApiResponse(responseCode = "404", description = "Чат ни разу не настраивался (автоответы выключены)")
    public HttpResponse<ChatLiveness> get(@PathVariable String chatId) {
        return livenessRegistry.get(chatId)
                .map(HttpResponse::ok)
                .orElseGet(HttpResponse::notFound);
    }

    @Get(uri = "/chats")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Все известные чаты, от недавно изменённых к давним")
    public List<ChatLiveness> list() {
        return livenessRegistry.snapshot();
    }

    @Get(uri = "/stats")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Статистика конвейера")
    @ApiResponse(responseCode = "200", description = "Статистика", content = @Content(schema = @Schema(implementation = StatsResponse.class)))
    public StatsResponse stats() {
        LivenessRegistry.Stats s = livenessRegistry.stats();
        return new StatsResponse(
                s.totalChats(),
                s.activeChats(),
                ledger.size(),
                notificationHub.clientCount(),
                notificationHub.history().size(),
                pipeline.pendingChats()
        );
    }

    @Post(uri = "/cleanup")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Выполнить обрезку журнала и реестра вне расписания")
    @ApiResponse(responseCode = "200", description = "Результат очистки", content = @Content(schema = @Schema(implementation = CleanupResponse.class)))
    public CleanupResponse cleanup() {
        int ledgerRemoved = ledger.cleanup();
        int chatsRemoved = livenessRegistry.cleanup();
        return new CleanupResponse(ledgerRemoved, chatsRemoved, ledger.size(), livenessRegistry.size());
    }

    @Serdeable
    @Schema(name = "AutoResponseToggleRequest", description = "Запрос на включение/выключение автоответов")
    public record ToggleRequest(
            @Schema(description = "Новое значение флага", requiredMode = Schema.RequiredMode.REQUIRED) Boolean active,
            @Schema(description = "Имя агента (null — не менять)") String agentName,
            @Schema(description = "URL внешнего агента (null — не менять)") String agentUrl
    ) {
    }

    @Serdeable
    @Schema(name = "AutoResponseStats", description = "Статистика конвейера")
    public record StatsResponse(
            @Schema(description = "Известных чатов") int totalChats,
            @Schema(description = "Чатов с включёнными автоответами") int activeChats,
            @Schema(description = "Записей в журнале обработанных сообщений") int processedMessages,
            @Schema(description = "Подключённых клиентов дашборда") int connectedClients,
            @Schema(description = "Уведомлений в истории") int historySize,
            @Schema(description = "Чатов с незавершённой обработкой") int pendingChats
    ) {
    }

    @Serdeable
    @Schema(name = "AutoResponseCleanup", description = "Результат очистки")
    public record CleanupResponse(
            @Schema(description = "Удалено из журнала") int ledgerRemoved,
            @Schema(description = "Удалено из реестра чатов") int chatsRemoved,
            @Schema(description = "Осталось в журнале") int ledgerSize,
            @Schema(description = "Осталось в реестре") int registrySize
    ) {
    }
}
