package org.example.driver_ledger.bot;

/**
 * Тип входящего события: текстовое сообщение или нажатие inline-кнопки.
 */
public enum EventKind {
    TEXT,
    CALLBACK
}
