package org.example.driver_ledger.conversation;

/**
 * Ключи накопителя (accumulator) диалога.
 */
public enum SessionField {
    NAME,
    NICKNAME,
    CAR_MODEL,
    CAR_NUMBER,
    AMOUNT
}
