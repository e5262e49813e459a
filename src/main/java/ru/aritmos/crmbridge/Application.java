package ru.aritmos.crmbridge;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа WhatsApp CRM Bridge.
 * <p>
 * Сервис принимает входящие события WhatsApp-сессии, решает, нужен ли по ним автоответ,
 * ровно один раз передаёт подходящие сообщения генератору ответа и рассылает изменения
 * состояния всем подключённым клиентам дашборда.
 * <p>
 * Важно: драйвер WhatsApp Web, LLM-провайдер и транспорт WebSocket подключаются через узкие интерфейсы,
 * ядро конвейера от них не зависит.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
