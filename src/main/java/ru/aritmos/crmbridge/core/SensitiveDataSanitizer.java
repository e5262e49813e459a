package ru.aritmos.crmbridge.core;

/**
 * Санитайзер чувствительных данных для логов.
 * <p>
 * Ошибки LLM-провайдеров и HTTP-клиентов иногда содержат ключи API или заголовки авторизации.
 * Перед записью в лог такие фрагменты маскируются.
 * <p>
 * Важно: санитайзер работает эвристически и не является DLP-системой. Текст сообщений клиентов
 * в лог целиком не пишется, только короткое превью.
 */
public final class SensitiveDataSanitizer {

    private static final String MASK = "***";

    private SensitiveDataSanitizer() {
    }

    /**
     * Санитизировать текст (сообщения об ошибках, диагностические строки).
     * <p>
     * Эвристика:
     * <ul>
     *   <li>маскируем Bearer-токены;</li>
     *   <li>маскируем ключи вида {@code sk-...};</li>
     *   <li>маскируем {@code api_key=...} и похожие параметры.</li>
     * </ul>
     *
     * @param text исходный текст
     * @return санитизированный текст
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        String t = text;

        // Bearer <token>
        t = t.replaceAll("(?i)bearer\\s+[^\\s\"]+", "Bearer " + MASK);

        // Ключи OpenAI-совместимых провайдеров
        t = t.replaceAll("sk-[A-Za-z0-9_\\-]{6,}", "sk-" + MASK);

        t = t.replaceAll("(?i)(api[_-]?key|access_token|key)\\s*=\\s*[^\\s&]+", "$1=" + MASK);

        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }

    /**
     * Описание исключения для лога: класс и санитизированное сообщение.
     *
     * @param error исключение (может быть null)
     * @return строка для лога
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String msg = sanitizeText(error.getMessage());
        return error.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }
}
