package org.example.driver_ledger.bot;

/**
 * Отправка сообщений пользователю.
 *
 * В проде это Bot (Telegram), в тестах - мок.
 * Ошибки Telegram внутри реализации логируются и наружу не летят.
 */
public interface MessageSender {

    void send(OutgoingMessage message);

    /**
     * Ответить на нажатие inline-кнопки, чтобы она не "висела" с часиками.
     */
    void answerCallback(String callbackId);

    /**
     * Удалить сообщение бота (например, карточку профиля по кнопке "Закрити").
     */
    void deleteMessage(Long chatId, Integer messageId);

    default void send(Long chatId, String text) {
        send(OutgoingMessage.plain(chatId, text));
    }

    default void send(Long chatId, String text, KeyboardLayout keyboard) {
        send(OutgoingMessage.withKeyboard(chatId, text, keyboard));
    }
}
