package ru.aritmos.crmbridge.config;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Источник времени для проверок «свежести» сообщений.
 * <p>
 * Компоненты получают {@link Clock} через DI и не читают глобальное время напрямую,
 * поэтому в тестах достаточно подставить {@link Clock#fixed}.
 */
@Factory
public class ClockFactory {

    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
