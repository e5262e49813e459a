package ru.aritmos.crmbridge.model;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Снимок состояния автоответов для одного чата.
 * <p>
 * Экземпляр неизменяем: реестр заменяет снимок целиком при каждой мутации.
 * {@code touchSequence} растёт монотонно и используется для вытеснения по давности изменения.
 */
@Serdeable
@Introspected
@Schema(name = "ChatLiveness", description = "Состояние автоответов чата")
public record ChatLiveness(
        @Schema(description = "Идентификатор чата") String chatId,
        @Schema(description = "Автоответы включены") boolean enabled,
        @Schema(description = "Последнее обработанное сообщение") String lastProcessedMessageId,
        @Schema(description = "Агент автоответов") AgentPersona persona,
        @Schema(description = "Порядковый номер последнего изменения") long touchSequence,
        @Schema(description = "Время последнего изменения") Instant updatedAt
) {

    public ChatLiveness withEnabled(boolean value, long sequence, Instant now) {
        return new ChatLiveness(chatId, value, lastProcessedMessageId, persona, sequence, now);
    }

    public ChatLiveness withPersona(AgentPersona value, long sequence, Instant now) {
        return new ChatLiveness(chatId, enabled, lastProcessedMessageId, value, sequence, now);
    }

    public ChatLiveness withLastProcessed(String messageId, long sequence, Instant now) {
        return new ChatLiveness(chatId, enabled, messageId, persona, sequence, now);
    }
}
