package ru.aritmos.crmbridge.core;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.config.PipelineProperties;
import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.MessageEvent;
import ru.aritmos.crmbridge.notification.NotificationHub;
import ru.aritmos.crmbridge.notification.Notifications;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Диспетчер автоответов.
 * <p>
 * Порядок обработки события:
 * <ol>
 *   <li>чат выключен — отказ;</li>
 *   <li>классификатор отклонил событие — отказ;</li>
 *   <li>messageId уже есть в журнале — отказ (повторная доставка);</li>
 *   <li>messageId записывается как последний обработанный <b>до</b> генерации;</li>
 *   <li>генерация с таймаутом; ошибка или пустой ответ — ничего не отправляем;</li>
 *   <li>отправка в чат и уведомление {@code NEW_MESSAGE} на дашборд.</li>
 * </ol>
 * <p>
 * Важно: сообщение считается потреблённым ещё до генерации. Если генерация или отправка не удались,
 * повтора не будет.
 * <p>
 * Ошибки внешних вызовов не выходят за пределы {@link #handle(MessageEvent, MessageSender)}:
 * неудача одного автоответа не должна блокировать следующие сообщения.
 */
@Singleton
public class AutoResponseDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AutoResponseDispatcher.class);

    private static final int LOG_PREVIEW_LENGTH = 50;

    private final LivenessRegistry livenessRegistry;
    private final MessageClassifier classifier;
    private final DedupLedger ledger;
    private final ReplyGenerator generator;
    private final NotificationHub notificationHub;
    private final Clock clock;
    private final Duration recencyWindow;
    private final Duration generationTimeout;

    @Inject
    public AutoResponseDispatcher(LivenessRegistry livenessRegistry,
                                  MessageClassifier classifier,
                                  DedupLedger ledger,
                                  ReplyGenerator generator,
                                  NotificationHub notificationHub,
                                  Clock clock,
                                  PipelineProperties properties) {
        this(livenessRegistry, classifier, ledger, generator, notificationHub, clock,
                properties.getRecencyWindow(), properties.getGenerationTimeout());
    }

    public AutoResponseDispatcher(LivenessRegistry livenessRegistry,
                                  MessageClassifier classifier,
                                  DedupLedger ledger,
                                  ReplyGenerator generator,
                                  NotificationHub notificationHub,
                                  Clock clock,
                                  Duration recencyWindow,
                                  Duration generationTimeout) {
        this.livenessRegistry = livenessRegistry;
        this.classifier = classifier;
        this.ledger = ledger;
        this.generator = generator;
        this.notificationHub = notificationHub;
        this.clock = clock;
        this.recencyWindow = recencyWindow;
        this.generationTimeout = generationTimeout;
    }

    /**
     * Обработать входящее событие.
     *
     * @param event  входящее событие
     * @param sender отправка в чат (драйвер WhatsApp нужного аккаунта)
     * @return true, если ответ сгенерирован и отправлен
     */
    public boolean handle(MessageEvent event, MessageSender sender) {
        if (event == null) {
            return false;
        }
        String chatId = event.chatId();

        if (!livenessRegistry.isActive(chatId)) {
            log.debug("Автоответы выключены для чата {}, сообщение {} пропущено", chatId, event.messageId());
            return false;
        }

        MessageClassifier.Verdict verdict = classifier.classify(event, recencyWindow,
                livenessRegistry.lastProcessedMessageId(chatId));
        if (verdict != MessageClassifier.Verdict.ELIGIBLE) {
            log.debug("Сообщение {} в чате {} не подходит для автоответа: {}", event.messageId(), chatId, verdict);
            return false;
        }

        if (!ledger.markIfNew(event.messageId())) {
            log.debug("Сообщение {} уже обработано ранее, повторная доставка пропущена", event.messageId());
            return false;
        }

        livenessRegistry.recordProcessed(chatId, event.messageId());

        AgentPersona persona = livenessRegistry.persona(chatId);
        log.info("Автоответ: чат={} сообщение={} агент={} текст=\"{}\"",
                chatId, event.messageId(), persona.agentName(), event.preview(LOG_PREVIEW_LENGTH));

        String reply = generate(event, persona);
        if (reply == null) {
            return false;
        }

        if (!send(sender, chatId, reply)) {
            return false;
        }

        notificationHub.broadcast(Notifications.autoReply(event, reply, persona, clock.instant()));
        log.info("Автоответ отправлен в чат {} (сообщение {})", chatId, event.messageId());
        return true;
    }

    private String generate(MessageEvent event, AgentPersona persona) {
        CompletableFuture<String> future = null;
        try {
            future = generator.generate(event.body(), persona);
            String text = future.get(generationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null || text.isBlank()) {
                log.warn("Генератор {} вернул пустой ответ для сообщения {}", generator.id(), event.messageId());
                return null;
            }
            return text.trim();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Генерация ответа для сообщения {} не уложилась в {} мс", event.messageId(), generationTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Генерация ответа для сообщения {} прервана", event.messageId());
        } catch (ExecutionException e) {
            log.warn("Ошибка генерации ответа для сообщения {}: {}", event.messageId(), SensitiveDataSanitizer.describe(e.getCause()));
        } catch (RuntimeException e) {
            log.warn("Ошибка генерации ответа для сообщения {}: {}", event.messageId(), SensitiveDataSanitizer.describe(e));
        }
        return null;
    }

    private boolean send(MessageSender sender, String chatId, String reply) {
        if (sender == null) {
            log.warn("Нет отправителя для чата {}, автоответ не отправлен", chatId);
            return false;
        }
        try {
            CompletableFuture<Void> sent = sender.send(chatId, reply);
            if (sent != null) {
                sent.get();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Отправка автоответа в чат {} прервана", chatId);
        } catch (ExecutionException e) {
            log.warn("Не удалось отправить автоответ в чат {}: {}", chatId, SensitiveDataSanitizer.describe(e.getCause()));
        } catch (RuntimeException e) {
            log.warn("Не удалось отправить автоответ в чат {}: {}", chatId, SensitiveDataSanitizer.describe(e));
        }
        return false;
    }
}
