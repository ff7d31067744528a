package org.example.driver_ledger.conversation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Хранилище диалогов.
 * Ключ: telegramId пользователя
 * Значение: текущий шаг + введённые данные
 *
 * ConcurrentHashMap - потокобезопасный, т.к. сообщения от разных юзеров
 * могут обрабатываться одновременно. Живёт в памяти: после рестарта
 * все незаконченные диалоги теряются.
 */
@Slf4j
@Component
public class ConversationSessionStore {

    private final Map<Long, ConversationSession> sessions = new ConcurrentHashMap<>();

    public Optional<ConversationSession> find(Long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    /**
     * Начать новый диалог. Старый (если был) затирается.
     */
    public ConversationSession start(Long userId, ConversationState initialState) {
        ConversationSession session = new ConversationSession(userId, initialState);
        ConversationSession previous = sessions.put(userId, session);
        if (previous != null) {
            log.debug("Незаконченный диалог перезаписан: telegramId={}, was={}", userId, previous.getState());
        }
        log.debug("Диалог начат: telegramId={}, state={}", userId, initialState);
        return session;
    }

    /**
     * Завершить диалог (успех, отмена или ошибка). Пользователь снова Idle.
     */
    public void clear(Long userId) {
        if (sessions.remove(userId) != null) {
            log.debug("Диалог завершён: telegramId={}", userId);
        }
    }

    public boolean isIdle(Long userId) {
        return !sessions.containsKey(userId);
    }
}
