package org.example.driver_ledger.bot;

/**
 * Исходящее сообщение: кому, что и (опционально) какая клавиатура.
 */
public record OutgoingMessage(Long chatId, String text, KeyboardLayout keyboard) {

    public static OutgoingMessage plain(Long chatId, String text) {
        return new OutgoingMessage(chatId, text, null);
    }

    public static OutgoingMessage withKeyboard(Long chatId, String text, KeyboardLayout keyboard) {
        return new OutgoingMessage(chatId, text, keyboard);
    }

    public boolean hasKeyboard() {
        return keyboard != null;
    }
}
