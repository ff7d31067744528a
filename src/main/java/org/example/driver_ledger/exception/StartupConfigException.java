package org.example.driver_ledger.exception;

/**
 * Фатальная ошибка конфигурации при старте (например, нет BOT_TOKEN).
 * Приложение с ней не поднимается.
 */
public class StartupConfigException extends LedgerBotException {

    public StartupConfigException(String message) {
        super(message);
    }
}
