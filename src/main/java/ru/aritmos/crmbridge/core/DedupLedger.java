package ru.aritmos.crmbridge.core;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmbridge.config.PipelineProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Журнал обработанных messageId — шлюз идемпотентности конвейера.
 * <p>
 * Драйвер WhatsApp и разные пути доставки могут передавать одно и то же событие повторно
 * (at-least-once). Журнал гарантирует, что {@link #markIfNew(String)} вернёт {@code true}
 * ровно один раз для каждого id.
 * <p>
 * Точечных удалений нет: память освобождается массовой обрезкой ({@link #cleanup()}),
 * которая оставляет самые свежие записи.
 */
@Singleton
public class DedupLedger {

    private static final Logger log = LoggerFactory.getLogger(DedupLedger.class);

    private final ConcurrentHashMap<String, Long> processed = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int threshold;
    private final int retain;

    @Inject
    public DedupLedger(PipelineProperties properties) {
        this(properties.getLedger().getThreshold(), properties.getLedger().getRetain());
    }

    public DedupLedger(int threshold, int retain) {
        this.threshold = Math.max(1, threshold);
        this.retain = Math.max(0, Math.min(retain, this.threshold));
    }

    /**
     * Атомарно отметить messageId как обработанный.
     *
     * @param messageId идентификатор сообщения
     * @return true, если id встречен впервые; false для повторов и пустых id
     */
    public boolean markIfNew(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return false;
        }
        return processed.putIfAbsent(messageId, sequence.incrementAndGet()) == null;
    }

    public boolean contains(String messageId) {
        return messageId != null && processed.containsKey(messageId);
    }

    public int size() {
        return processed.size();
    }

    /**
     * Обрезать журнал, если он превысил порог.
     * <p>
     * Остаются {@code retain} самых поздних записей. Запись удаляется только если её не перезаписали
     * во время обрезки.
     *
     * @return количество удалённых записей
     */
    public int cleanup() {
        int size = processed.size();
        if (size <= threshold) {
            return 0;
        }

        List<Map.Entry<String, Long>> entries = new ArrayList<>(processed.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());

        int removed = 0;
        for (int i = retain; i < entries.size(); i++) {
            Map.Entry<String, Long> e = entries.get(i);
            if (processed.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        log.info("Журнал messageId обрезан: было={}, удалено={}, осталось={}", size, removed, processed.size());
        return removed;
    }

    @Scheduled(fixedDelay = "${wacrm.pipeline.cleanup-interval:1h}", initialDelay = "${wacrm.pipeline.cleanup-interval:1h}")
    public void scheduledCleanup() {
        cleanup();
    }
}
