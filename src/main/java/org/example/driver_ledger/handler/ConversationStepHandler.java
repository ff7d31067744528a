package org.example.driver_ledger.handler;

import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.conversation.ConversationSession;
import org.example.driver_ledger.conversation.ConversationState;

import java.util.Set;

/**
 * Обработчик шагов одного или нескольких диалогов.
 *
 * UpdateDispatcher по текущему состоянию пользователя находит нужный обработчик
 * и отдаёт ему сообщение. На неверный ввод обработчик бросает ValidationException -
 * состояние при этом не меняется.
 */
public interface ConversationStepHandler {

    /**
     * Состояния, которые обслуживает этот обработчик.
     */
    Set<ConversationState> handledStates();

    /**
     * Обработать текстовый ответ пользователя на текущем шаге.
     */
    void handleStep(IncomingEvent event, ConversationSession session);
}
