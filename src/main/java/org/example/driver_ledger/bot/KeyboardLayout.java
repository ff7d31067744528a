package org.example.driver_ledger.bot;

import java.util.List;

/**
 * Описание клавиатуры под сообщением.
 *
 * REPLY_MENU - постоянное меню внизу экрана (только подписи),
 * INLINE - кнопки под сообщением с callback_data.
 */
public record KeyboardLayout(Type type, List<List<Button>> rows) {

    public enum Type {
        REPLY_MENU,
        INLINE
    }

    /**
     * Кнопка. Для REPLY_MENU callbackData == null.
     */
    public record Button(String label, String callbackData) {

        public static Button label(String label) {
            return new Button(label, null);
        }

        public static Button inline(String label, String callbackData) {
            return new Button(label, callbackData);
        }
    }

    public static KeyboardLayout replyMenu(List<List<Button>> rows) {
        return new KeyboardLayout(Type.REPLY_MENU, rows);
    }

    public static KeyboardLayout inline(List<List<Button>> rows) {
        return new KeyboardLayout(Type.INLINE, rows);
    }
}
