package ru.aritmos.crmbridge.core;

import jakarta.inject.Singleton;
import ru.aritmos.crmbridge.model.MessageEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Классификатор входящих событий: подходит ли сообщение для автоответа.
 * <p>
 * Правила применяются по порядку, первое невыполненное отклоняет событие:
 * <ol>
 *   <li>сообщение написал собеседник, а не наш аккаунт;</li>
 *   <li>сообщение не совпадает с последним обработанным в этом чате;</li>
 *   <li>сообщение не старше окна свежести (иначе это история, подтянутая после переподключения);</li>
 *   <li>время сообщения не опережает часы сервиса больше чем на {@link #FUTURE_TOLERANCE}
 *   (иначе это ошибка единиц, например миллисекунды вместо секунд);</li>
 *   <li>текст не пуст после trim.</li>
 * </ol>
 * <p>
 * Классификатор не имеет побочных эффектов и не зависит от состояния журнала и реестра:
 * последний обработанный id передаётся аргументом.
 */
@Singleton
public class MessageClassifier {

    public static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofMinutes(2);

    /** Допустимое расхождение часов драйвера и сервиса. */
    public static final Duration FUTURE_TOLERANCE = Duration.ofSeconds(30);

    private final Clock clock;

    public MessageClassifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Результат классификации.
     */
    public enum Verdict {
        ELIGIBLE,
        /** Нет chatId/messageId или события нет вовсе. */
        MALFORMED,
        NOT_FROM_USER,
        ALREADY_PROCESSED,
        STALE,
        /** Время сообщения в будущем с учётом допуска. */
        FROM_FUTURE,
        EMPTY_BODY
    }

    public boolean isEligible(MessageEvent event, Duration recencyWindow) {
        return isEligible(event, recencyWindow, null);
    }

    public boolean isEligible(MessageEvent event, Duration recencyWindow, String lastProcessedMessageId) {
        return classify(event, recencyWindow, lastProcessedMessageId) == Verdict.ELIGIBLE;
    }

    /**
     * Классифицировать событие.
     *
     * @param event                  входящее событие
     * @param recencyWindow          окно свежести (null — 2 минуты)
     * @param lastProcessedMessageId последний обработанный id этого чата (может быть null)
     * @return вердикт
     */
    public Verdict classify(MessageEvent event, Duration recencyWindow, String lastProcessedMessageId) {
        if (event == null || isBlank(event.chatId()) || isBlank(event.messageId())) {
            return Verdict.MALFORMED;
        }
        if (!event.fromUser()) {
            return Verdict.NOT_FROM_USER;
        }
        if (event.messageId().equals(lastProcessedMessageId)) {
            return Verdict.ALREADY_PROCESSED;
        }
        Duration window = recencyWindow == null ? DEFAULT_RECENCY_WINDOW : recencyWindow;
        long ageSeconds = clock.instant().getEpochSecond() - event.timestampEpochSeconds();
        if (ageSeconds > window.getSeconds()) {
            return Verdict.STALE;
        }
        if (ageSeconds < -FUTURE_TOLERANCE.getSeconds()) {
            return Verdict.FROM_FUTURE;
        }
        if (isBlank(event.body())) {
            return Verdict.EMPTY_BODY;
        }
        return Verdict.ELIGIBLE;
    }

    /**
     * Выбрать самое позднее сообщение собеседника из пачки (например, истории чата после синхронизации).
     * <p>
     * Автоответ даётся только на последнее сообщение, а не на всю историю.
     *
     * @param events события одного чата
     * @return самое позднее сообщение от пользователя
     */
    public Optional<MessageEvent> latestUserMessage(Collection<MessageEvent> events) {
        if (events == null || events.isEmpty()) {
            return Optional.empty();
        }
        return events.stream()
                .filter(Objects::nonNull)
                .filter(MessageEvent::fromUser)
                .max(Comparator.comparingLong(MessageEvent::timestampEpochSeconds));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
