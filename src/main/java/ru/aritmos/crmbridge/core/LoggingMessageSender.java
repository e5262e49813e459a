package ru.aritmos.crmbridge.core;

import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Отправитель "logging" — безопасная заглушка на случай, когда драйвер WhatsApp не подключён.
 * <p>
 * Позволяет проверить конвейер целиком (классификация, идемпотентность, генерация, уведомления)
 * без живой WhatsApp-сессии. В лог пишется только длина текста.
 */
@Singleton
@Secondary
public class LoggingMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessageSender.class);

    @Override
    public CompletableFuture<Void> send(String chatId, String text) {
        log.info("[SEND][LOGGING] chatId={} textLength={}", chatId, text == null ? 0 : text.length());
        return CompletableFuture.completedFuture(null);
    }
}
