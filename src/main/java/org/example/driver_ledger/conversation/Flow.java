package org.example.driver_ledger.conversation;

/**
 * Диалоги (флоу) бота. Каждый флоу - цепочка состояний ConversationState.
 */
public enum Flow {
    REGISTRATION,
    ADD_INCOME,
    ADD_EXPENSE,
    PERIOD_REPORT,
    EDIT_NAME,
    EDIT_CAR
}
