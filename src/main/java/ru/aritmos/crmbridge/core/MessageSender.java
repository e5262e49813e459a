package ru.aritmos.crmbridge.core;

import java.util.concurrent.CompletableFuture;

/**
 * Отправка сообщения в чат WhatsApp.
 * <p>
 * Реализуется драйвером WhatsApp-сессии конкретного аккаунта и передаётся в конвейер параметром,
 * поэтому ядро не зависит от менеджера аккаунтов.
 */
@FunctionalInterface
public interface MessageSender {

    /**
     * Отправить текст в чат.
     *
     * @param chatId идентификатор чата
     * @param text   текст
     * @return future, завершающийся после отправки (или исключением)
     */
    CompletableFuture<Void> send(String chatId, String text);
}
