package org.example.driver_ledger.exception;

/**
 * Базовое исключение бота.
 *
 * Всё, что летит из обработчиков диалога, ловится в UpdateDispatcher
 * и превращается в сообщение пользователю. До цикла поллинга не доходит.
 */
public class LedgerBotException extends RuntimeException {

    public LedgerBotException(String message) {
        super(message);
    }
}
