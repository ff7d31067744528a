package org.example.driver_ledger.exception;

/**
 * Пользователь пытается что-то записать в учёт, не пройдя регистрацию.
 */
public class NotRegisteredException extends LedgerBotException {

    private final Long userId;

    public NotRegisteredException(Long userId) {
        super("Ви не зареєстровані. Надішліть /start щоб зареєструватися.");
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
