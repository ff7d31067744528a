package org.example.driver_ledger.conversation;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Текущий диалог одного пользователя.
 *
 * Хранит:
 * - текущий шаг (state)
 * - уже введённые данные (accumulator), живут только пока идёт диалог
 *
 * В БД ничего не пишем после каждого шага - всё копится здесь
 * и сбрасывается разом на последнем шаге.
 */
@Getter
@ToString
public class ConversationSession {

    private final Long userId;
    private ConversationState state;
    private final Map<SessionField, String> accumulator = new EnumMap<>(SessionField.class);

    public ConversationSession(Long userId, ConversationState state) {
        this.userId = userId;
        this.state = state;
    }

    /**
     * Записать значение и перейти на следующий шаг.
     */
    public void advance(SessionField field, String value, ConversationState next) {
        accumulator.put(field, value);
        this.state = next;
    }

    public Optional<String> get(SessionField field) {
        return Optional.ofNullable(accumulator.get(field));
    }

    public Map<SessionField, String> getAccumulator() {
        return Collections.unmodifiableMap(accumulator);
    }

    public boolean isIn(ConversationState expected) {
        return state == expected;
    }
}
