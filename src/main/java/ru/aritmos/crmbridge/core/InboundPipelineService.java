package ru.aritmos.crmbridge.core;

import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.model.MessageEvent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Точка входа конвейера для всех путей доставки (REST webhook драйвера, повторная отправка, несколько аккаунтов).
 * <p>
 * Обработка выносится в IO executor. Внутри одного чата события выполняются строго по очереди
 * (цепочка future на чат), поэтому автоответы уходят в порядке прихода сообщений. Разные чаты
 * обрабатываются параллельно.
 * <p>
 * Хвост цепочки удаляется, как только очередь чата опустела, поэтому карта не растёт с числом чатов.
 */
@Singleton
public class InboundPipelineService {

    private static final Logger log = LoggerFactory.getLogger(InboundPipelineService.class);

    private final AutoResponseDispatcher dispatcher;
    private final MessageSender defaultSender;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, CompletableFuture<Boolean>> tails = new ConcurrentHashMap<>();

    public InboundPipelineService(AutoResponseDispatcher dispatcher,
                                  MessageSender defaultSender,
                                  @Named(TaskExecutors.IO) ExecutorService executor) {
        this.dispatcher = dispatcher;
        this.defaultSender = defaultSender;
        this.executor = executor;
    }

    public CompletableFuture<Boolean> submit(MessageEvent event) {
        return submit(event, defaultSender);
    }

    /**
     * Поставить событие в очередь его чата.
     *
     * @param event  входящее событие
     * @param sender отправка в чат для аккаунта, получившего событие
     * @return future с результатом диспетчера (true — автоответ отправлен)
     */
    public CompletableFuture<Boolean> submit(MessageEvent event, MessageSender sender) {
        if (event == null || event.chatId() == null || event.chatId().isBlank()) {
            return CompletableFuture.completedFuture(Boolean.FALSE);
        }
        String chatId = event.chatId();
        CompletableFuture<Boolean> next = tails.compute(chatId, (k, prev) -> {
            CompletableFuture<Boolean> base = prev == null ? CompletableFuture.completedFuture(Boolean.FALSE) : prev;
            return base.handle((r, e) -> Boolean.FALSE)
                    .thenApplyAsync(ignored -> dispatchSafely(event, sender), executor);
        });
        next.whenComplete((r, e) -> tails.remove(chatId, next));
        return next;
    }

    /**
     * Количество чатов, по которым сейчас есть незавершённая обработка.
     */
    public int pendingChats() {
        return tails.size();
    }

    private boolean dispatchSafely(MessageEvent event, MessageSender sender) {
        try {
            return dispatcher.handle(event, sender);
        } catch (RuntimeException e) {
            log.error("Сбой обработки сообщения {} в чате {}: {}",
                    event.messageId(), event.chatId(), SensitiveDataSanitizer.describe(e));
            return false;
        }
    }
}
