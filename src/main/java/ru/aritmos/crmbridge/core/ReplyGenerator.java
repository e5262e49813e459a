package ru.aritmos.crmbridge.core;

import ru.aritmos.crmbridge.model.AgentPersona;

import java.util.concurrent.CompletableFuture;

/**
 * Генератор текста автоответа (LLM-провайдер).
 * <p>
 * Вызов асинхронный: ограничение по времени накладывает вызывающая сторона
 * ({@link AutoResponseDispatcher}), реализация не обязана сама следить за таймаутом.
 */
public interface ReplyGenerator {

    /**
     * Идентификатор провайдера (например, {@code openai}).
     *
     * @return строковый id
     */
    String id();

    /**
     * Сгенерировать ответ на сообщение клиента.
     *
     * @param promptText текст входящего сообщения
     * @param persona    агент, от имени которого отвечаем
     * @return future с текстом ответа; при ошибке future завершается исключением
     */
    CompletableFuture<String> generate(String promptText, AgentPersona persona);

    /**
     * Ошибка генерации. Сообщение не должно содержать ключей и токенов.
     */
    final class GenerationException extends RuntimeException {

        public GenerationException(String message) {
            super(SensitiveDataSanitizer.sanitizeText(message));
        }

        public GenerationException(String message, Throwable cause) {
            super(SensitiveDataSanitizer.sanitizeText(message), cause);
        }
    }
}
