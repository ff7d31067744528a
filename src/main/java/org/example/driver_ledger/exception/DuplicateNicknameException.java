package org.example.driver_ledger.exception;

/**
 * Псевдоним уже занят (сравнение без учёта регистра).
 */
public class DuplicateNicknameException extends LedgerBotException {

    private final String nickname;

    public DuplicateNicknameException(String nickname) {
        super("Цей псевдонім вже зайнятий. Оберіть інший:");
        this.nickname = nickname;
    }

    public String getNickname() {
        return nickname;
    }
}
