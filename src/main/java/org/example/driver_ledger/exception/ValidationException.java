package org.example.driver_ledger.exception;

/**
 * Некорректный ввод пользователя (сумма, номер авто, даты...).
 *
 * Сообщение исключения - это готовый текст подсказки для пользователя.
 * Состояние диалога при этом НЕ меняется: ждём повторный ввод.
 */
public class ValidationException extends LedgerBotException {

    public ValidationException(String userMessage) {
        super(userMessage);
    }
}
