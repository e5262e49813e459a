package ru.aritmos.crmbridge.notification;

import java.util.concurrent.CompletableFuture;

/**
 * Двунаправленный канал до одного клиента дашборда (обычно WebSocket-сессия).
 */
public interface NotificationTransport {

    /**
     * Отправить JSON-кадр.
     * <p>
     * Ошибка отправки (исключение или future, завершившийся ошибкой) считается признаком отключения клиента.
     * Время ожидания ограничивает {@link NotificationHub}.
     *
     * @param json сериализованный кадр
     * @return future, завершающийся после записи кадра
     */
    CompletableFuture<Void> send(String json);

    boolean isOpen();
}
