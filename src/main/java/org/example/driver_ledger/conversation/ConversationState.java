package org.example.driver_ledger.conversation;

/**
 * Состояния диалога.
 * <p>
 * Каждый шаг - это один вопрос от бота.
 * Юзер отвечает → переходим на следующий шаг.
 * Отсутствие сессии = бот свободен (Idle) и ждёт команду или кнопку меню.
 *
 * РЕГИСТРАЦИЯ:
 * AWAITING_NAME → AWAITING_NICKNAME → AWAITING_CAR_MODEL → AWAITING_PLATE
 *
 * ДОХОД: AWAITING_AMOUNT
 * РАСХОД: AWAITING_AMOUNT → AWAITING_CATEGORY (inline-кнопки)
 * ОТЧЁТ ЗА ПЕРИОД: AWAITING_PERIOD
 * РЕДАКТИРОВАНИЕ: имя (AWAITING_NAME) или авто (AWAITING_CAR_MODEL → AWAITING_PLATE)
 */
public enum ConversationState {

    REGISTRATION_AWAITING_NAME(Flow.REGISTRATION, InputKind.TEXT),
    REGISTRATION_AWAITING_NICKNAME(Flow.REGISTRATION, InputKind.TEXT),
    REGISTRATION_AWAITING_CAR_MODEL(Flow.REGISTRATION, InputKind.TEXT),
    REGISTRATION_AWAITING_PLATE(Flow.REGISTRATION, InputKind.TEXT),

    INCOME_AWAITING_AMOUNT(Flow.ADD_INCOME, InputKind.TEXT),

    EXPENSE_AWAITING_AMOUNT(Flow.ADD_EXPENSE, InputKind.TEXT),
    /** Ждём нажатие кнопки категории, текст не принимаем */
    EXPENSE_AWAITING_CATEGORY(Flow.ADD_EXPENSE, InputKind.CALLBACK),

    REPORT_AWAITING_PERIOD(Flow.PERIOD_REPORT, InputKind.TEXT),

    EDIT_AWAITING_NAME(Flow.EDIT_NAME, InputKind.TEXT),
    EDIT_AWAITING_CAR_MODEL(Flow.EDIT_CAR, InputKind.TEXT),
    EDIT_AWAITING_PLATE(Flow.EDIT_CAR, InputKind.TEXT);

    private final Flow flow;
    private final InputKind inputKind;

    ConversationState(Flow flow, InputKind inputKind) {
        this.flow = flow;
        this.inputKind = inputKind;
    }

    public Flow getFlow() {
        return flow;
    }

    public boolean expectsText() {
        return inputKind == InputKind.TEXT;
    }
}
