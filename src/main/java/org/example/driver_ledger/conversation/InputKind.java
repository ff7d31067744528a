package org.example.driver_ledger.conversation;

/**
 * Какой ввод ждёт состояние: обычный текст или нажатие inline-кнопки.
 */
public enum InputKind {
    TEXT,
    CALLBACK
}
