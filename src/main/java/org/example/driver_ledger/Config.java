package org.example.driver_ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Slf4j
@Configuration
public class Config {
    /**
     * Регистрирует Telegram-бота (long polling) как Spring-бин.
     *
     * @param bot - основной Bot
     * @return TelegramBotsApi
     */
    @Bean
    TelegramBotsApi telegramBotsApi(Bot bot) throws TelegramApiException {
        TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
        try {
            telegramBotsApi.registerBot(bot);
            log.info("Бот успешно зарегистрирован: @{}", bot.getBotUsername());
        } catch (TelegramApiException e) {
            log.error("КРИТИЧЕСКАЯ ОШИБКА: не удалось зарегистрировать бота в Telegram API", e);
            throw new IllegalStateException(
                    "Не удалось зарегистрировать Telegram бота. Проверьте токен и подключение к интернету.", e);
        }
        return telegramBotsApi;
    }
}
