package ru.aritmos.crmbridge.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed-конфигурация конвейера входящих сообщений.
 * <p>
 * Единая точка чтения настроек {@code wacrm.pipeline.*} из application.yml/ENV.
 * Все сеттеры нормализуют значения: некорректный ввод заменяется значением по умолчанию.
 */
@ConfigurationProperties("wacrm.pipeline")
public class PipelineProperties {

    private static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofMinutes(2);
    private static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(1);
    private static final Duration DEFAULT_SOCKET_SEND_TIMEOUT = Duration.ofSeconds(5);

    private Duration recencyWindow = DEFAULT_RECENCY_WINDOW;
    private Duration generationTimeout = DEFAULT_GENERATION_TIMEOUT;
    private Duration cleanupInterval = DEFAULT_CLEANUP_INTERVAL;
    private Duration socketSendTimeout = DEFAULT_SOCKET_SEND_TIMEOUT;
    private int historyCapacity = 100;

    private Ledger ledger = new Ledger();
    private Liveness liveness = new Liveness();

    public Duration getRecencyWindow() {
        return recencyWindow;
    }

    public void setRecencyWindow(Duration recencyWindow) {
        this.recencyWindow = positiveOr(recencyWindow, DEFAULT_RECENCY_WINDOW);
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = positiveOr(generationTimeout, DEFAULT_GENERATION_TIMEOUT);
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = positiveOr(cleanupInterval, DEFAULT_CLEANUP_INTERVAL);
    }

    /**
     * Сколько хаб ждёт записи кадра в один канал дашборда, прежде чем удалить клиента.
     */
    public Duration getSocketSendTimeout() {
        return socketSendTimeout;
    }

    public void setSocketSendTimeout(Duration socketSendTimeout) {
        this.socketSendTimeout = positiveOr(socketSendTimeout, DEFAULT_SOCKET_SEND_TIMEOUT);
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = Math.max(1, historyCapacity);
    }

    public Ledger getLedger() {
        return ledger;
    }

    public void setLedger(Ledger ledger) {
        this.ledger = ledger == null ? new Ledger() : ledger;
    }

    public Liveness getLiveness() {
        return liveness;
    }

    public void setLiveness(Liveness liveness) {
        this.liveness = liveness == null ? new Liveness() : liveness;
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) {
            return fallback;
        }
        return value;
    }

    /**
     * Границы журнала обработанных messageId.
     */
    @ConfigurationProperties("ledger")
    public static class Ledger {
        private int threshold = 10_000;
        private int retain = 5_000;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = Math.max(1, threshold);
        }

        public int getRetain() {
            return Math.min(retain, threshold);
        }

        public void setRetain(int retain) {
            this.retain = Math.max(0, retain);
        }
    }

    /**
     * Границы реестра активности чатов.
     */
    @ConfigurationProperties("liveness")
    public static class Liveness {
        private int threshold = 100;
        private int retain = 50;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = Math.max(1, threshold);
        }

        public int getRetain() {
            return Math.min(retain, threshold);
        }

        public void setRetain(int retain) {
            this.retain = Math.max(0, retain);
        }
    }
}
