package org.example.driver_ledger.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.exception.StartupConfigException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Настройки Telegram-бота.
 * <p>
 * Токен берётся из переменной окружения BOT_TOKEN (через application.properties).
 * Нет токена - бот не стартует, и правильно.
 */
@Slf4j
@Getter
@Configuration
public class BotConfig {

    @Value("${telegram.bot.token:}")
    private String token;

    @Value("${telegram.bot.username:driver_ledger_bot}")
    private String username;

    @PostConstruct
    public void init() {
        requireToken(token);
        log.info("Telegram-бот: @{}", username);
    }

    /**
     * Проверить, что токен задан.
     *
     * @throws StartupConfigException если токена нет
     */
    public static String requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw new StartupConfigException(
                    "BOT_TOKEN не знайдено в змінних оточення. Додайте BOT_TOKEN в оточення сервера.");
        }
        return token.trim();
    }
}
