package ru.aritmos.crmbridge.core;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.config.PersonaProperties;
import ru.aritmos.crmbridge.config.PipelineProperties;
import ru.aritmos.crmbridge.model.AgentPersona;
import ru.aritmos.crmbridge.model.ChatLiveness;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Реестр активности автоответов по чатам.
 * <p>
 * Для каждого чата, который когда-либо включали или выключали, хранится снимок {@link ChatLiveness}:
 * флаг, последний обработанный messageId и агент. Отсутствующий чат считается выключенным.
 * <p>
 * Долгоживущий процесс видит всё новые чаты, поэтому реестр периодически обрезается
 * ({@link #cleanup()}): при превышении порога остаются только самые недавно изменённые включённые чаты.
 * Порядок вытеснения приблизительный, гарантируется только размер.
 */
@Singleton
public class LivenessRegistry {

    private static final Logger log = LoggerFactory.getLogger(LivenessRegistry.class);

    private final ConcurrentHashMap<String, ChatLiveness> chats = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final AgentPersona defaultPersona;
    private final int threshold;
    private final int retain;

    @Inject
    public LivenessRegistry(Clock clock, PipelineProperties properties, PersonaProperties personaProperties) {
        this(clock,
                personaProperties.defaultPersona(),
                properties.getLiveness().getThreshold(),
                properties.getLiveness().getRetain());
    }

    public LivenessRegistry(Clock clock, AgentPersona defaultPersona, int threshold, int retain) {
        this.clock = clock;
        this.defaultPersona = defaultPersona == null ? new AgentPersona(null, null) : defaultPersona;
        this.threshold = Math.max(1, threshold);
        this.retain = Math.max(0, Math.min(retain, this.threshold));
    }

    /**
     * Статистика реестра.
     */
    public record Stats(int totalChats, int activeChats) {
    }

    public ChatLiveness activate(String chatId) {
        return configure(chatId, true, null);
    }

    public ChatLiveness deactivate(String chatId) {
        return configure(chatId, false, null);
    }

    /**
     * Установить флаг и (опционально) агента для чата. Запись создаётся при отсутствии.
     * <p>
     * Переключение не обрабатывает задним числом сообщения, пропущенные в выключенном состоянии.
     *
     * @param chatId  идентификатор чата
     * @param enabled новое значение флага
     * @param persona агент; null — оставить текущего (или агента по умолчанию для новой записи)
     * @return новый снимок состояния
     */
    public ChatLiveness configure(String chatId, boolean enabled, AgentPersona persona) {
        String id = requireChatId(chatId);
        ChatLiveness updated = chats.compute(id, (k, current) -> {
            long seq = sequence.incrementAndGet();
            Instant now = clock.instant();
            if (current == null) {
                return new ChatLiveness(k, enabled, null, persona == null ? defaultPersona : persona, seq, now);
            }
            ChatLiveness next = current.withEnabled(enabled, seq, now);
            return persona == null ? next : next.withPersona(persona, seq, now);
        });
        log.info("Автоответы {} для чата {} (агент={})", enabled ? "включены" : "выключены", id, updated.persona().agentName());
        return updated;
    }

    public boolean isActive(String chatId) {
        return get(chatId).map(ChatLiveness::enabled).orElse(false);
    }

    public Optional<ChatLiveness> get(String chatId) {
        String id = normalize(chatId);
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chats.get(id));
    }

    public String lastProcessedMessageId(String chatId) {
        return get(chatId).map(ChatLiveness::lastProcessedMessageId).orElse(null);
    }

    public AgentPersona persona(String chatId) {
        return get(chatId).map(ChatLiveness::persona).orElse(defaultPersona);
    }

    /**
     * Запомнить последнее обработанное сообщение чата. Для отсутствующего чата ничего не делает.
     */
    public void recordProcessed(String chatId, String messageId) {
        String id = normalize(chatId);
        if (id == null || messageId == null) {
            return;
        }
        chats.computeIfPresent(id, (k, current) ->
                current.withLastProcessed(messageId, sequence.incrementAndGet(), clock.instant()));
    }

    public List<String> activeChats() {
        List<String> out = new ArrayList<>();
        for (ChatLiveness c : chats.values()) {
            if (c.enabled()) {
                out.add(c.chatId());
            }
        }
        return out;
    }

    public List<ChatLiveness> snapshot() {
        List<ChatLiveness> out = new ArrayList<>(chats.values());
        out.sort(Comparator.comparingLong(ChatLiveness::touchSequence).reversed());
        return out;
    }

    public Stats stats() {
        int total = 0;
        int active = 0;
        for (ChatLiveness c : chats.values()) {
            total++;
            if (c.enabled()) {
                active++;
            }
        }
        return new Stats(total, active);
    }

    public int size() {
        return chats.size();
    }

    /**
     * Обрезать реестр при превышении порога.
     * <p>
     * Остаются не более {@code retain} включённых чатов с самыми свежими изменениями; выключенные удаляются.
     * Снимок, изменённый во время обрезки, не удаляется.
     *
     * @return количество удалённых записей
     */
    public int cleanup() {
        int size = chats.size();
        if (size <= threshold) {
            return 0;
        }

        List<ChatLiveness> all = new ArrayList<>(chats.values());
        Set<String> keep = new HashSet<>();
        all.stream()
                .filter(ChatLiveness::enabled)
                .sorted(Comparator.comparingLong(ChatLiveness::touchSequence).reversed())
                .limit(retain)
                .forEach(c -> keep.add(c.chatId()));

        int removed = 0;
        for (ChatLiveness c : all) {
            if (!keep.contains(c.chatId()) && chats.remove(c.chatId(), c)) {
                removed++;
            }
        }
        log.info("Реестр активности чатов обрезан: было={}, удалено={}, осталось={}", size, removed, chats.size());
        return removed;
    }

    @Scheduled(fixedDelay = "${wacrm.pipeline.cleanup-interval:1h}", initialDelay = "${wacrm.pipeline.cleanup-interval:1h}")
    public void scheduledCleanup() {
        cleanup();
    }

    private static String requireChatId(String chatId) {
        String id = normalize(chatId);
        if (id == null) {
            throw new IllegalArgumentException("Не задан chatId");
        }
        return id;
    }

    /**
     * Ключ чата в реестре: id без пробелов по краям, пустой id — null.
     */
    private static String normalize(String chatId) {
        if (chatId == null || chatId.isBlank()) {
            return null;
        }
        return chatId.trim();
    }
}
