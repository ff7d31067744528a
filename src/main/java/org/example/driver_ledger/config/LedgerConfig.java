package org.example.driver_ledger.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.time.Clock;

/**
 * Настройки учёта.
 * <p>
 * Все метки времени пишем в UTC - отсюда единые часы для всего приложения
 * (в тестах подменяются фиксированными).
 */
@Slf4j
@Getter
@Configuration
public class LedgerConfig {

    /**
     * Сколько водителей показывать в "🏆 Топ водіїв".
     */
    @Value("${ledger.leaderboard.size:10}")
    private int leaderboardSize;

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @PostConstruct
    public void init() {
        log.info("Размер рейтинга водителей: {}", leaderboardSize);
    }
}
