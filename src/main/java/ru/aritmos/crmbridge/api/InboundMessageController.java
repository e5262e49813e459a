package ru.aritmos.crmbridge.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.crmbridge.core.InboundPipelineService;
import ru.aritmos.crmbridge.core.MessageClassifier;
import ru.aritmos.crmbridge.core.SensitiveDataSanitizer;
import ru.aritmos.crmbridge.model.MessageEvent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Webhook для драйвера WhatsApp: приём входящих сообщений.
 * <p>
 * Обработка асинхронная: ответ {@code 202} означает только постановку в очередь чата.
 * Повторная доставка того же messageId безопасна.
 */
@Controller("/api/whatsapp")
@Tag(name = "WhatsApp CRM Bridge — входящие сообщения", description = "Приём событий от драйвера WhatsApp")
public class InboundMessageController {

    private final InboundPipelineService pipeline;
    private final MessageClassifier classifier;

    public InboundMessageController(InboundPipelineService pipeline, MessageClassifier classifier) {
        this.pipeline = pipeline;
        this.classifier = classifier;
    }

    @Post(uri = "/messages", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Принять входящее сообщение",
            description = "Событие ставится в очередь своего чата; автоответ генерируется не более одного раза на messageId.")
    @ApiResponse(responseCode = "202", description = "Сообщение поставлено в очередь", content = @Content(schema = @Schema(implementation = InboundResult.class)))
    @ApiResponse(responseCode = "400", description = "Не заданы chatId или messageId", content = @Content(schema = @Schema(implementation = InboundResult.class)))
    public HttpResponse<InboundResult> message(@Body MessageEvent event) {
        try {
            validate(event);
            pipeline.submit(event);
            return HttpResponse.accepted().body(new InboundResult("QUEUED", event.chatId(), event.messageId(), null));
        } catch (IllegalArgumentException ex) {
            return HttpResponse.badRequest(new InboundResult("REJECTED", null, null, SensitiveDataSanitizer.sanitizeText(ex.getMessage())));
        }
    }

    @Post(uri = "/messages/batch", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Принять пачку сообщений одного чата",
            description = "Используется при синхронизации истории: в конвейер уходит только самое позднее сообщение собеседника.")
    @ApiResponse(responseCode = "202", description = "Последнее сообщение поставлено в очередь", content = @Content(schema = @Schema(implementation = InboundResult.class)))
    @ApiResponse(responseCode = "200", description = "Сообщений собеседника нет", content = @Content(schema = @Schema(implementation = InboundResult.class)))
    public HttpResponse<InboundResult> batch(@Body MessageBatch batch) {
        List<MessageEvent> events = batch == null || batch.messages() == null ? List.of() : batch.messages();
        List<MessageEvent> valid = events.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.chatId() != null && !e.chatId().isBlank() && e.messageId() != null && !e.messageId().isBlank())
                .toList();

        Optional<MessageEvent> latest = classifier.latestUserMessage(valid);
        if (latest.isEmpty()) {
            return HttpResponse.ok(new InboundResult("IGNORED", null, null, "Нет сообщений собеседника"));
        }
        MessageEvent event = latest.get();
        pipeline.submit(event);
        return HttpResponse.accepted().body(new InboundResult("QUEUED", event.chatId(), event.messageId(), null));
    }

    private static void validate(MessageEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Пустое тело запроса");
        }
        if (event.chatId() == null || event.chatId().isBlank()) {
            throw new IllegalArgumentException("Не задан chatId");
        }
        if (event.messageId() == null || event.messageId().isBlank()) {
            throw new IllegalArgumentException("Не задан messageId");
        }
    }

    @Serdeable
    @Schema(name = "MessageBatch", description = "Пачка сообщений одного чата")
    public record MessageBatch(@Schema(description = "Сообщения") List<MessageEvent> messages) {
    }

    @Serdeable
    @Schema(name = "InboundResult", description = "Результат приёма сообщения")
    public record InboundResult(
            @Schema(description = "QUEUED / IGNORED / REJECTED") String outcome,
            @Schema(description = "Чат") String chatId,
            @Schema(description = "Сообщение, поставленное в очередь") String messageId,
            @Schema(description = "Пояснение") String note
    ) {
    }
}
