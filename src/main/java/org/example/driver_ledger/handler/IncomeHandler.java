package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.conversation.ConversationSession;
import org.example.driver_ledger.conversation.ConversationSessionStore;
import org.example.driver_ledger.conversation.ConversationState;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.service.InputParsers;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Кнопка "📥 Додати заробіток": один шаг - ввод суммы.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncomeHandler implements ConversationStepHandler {

    private final LedgerService ledgerService;
    private final ConversationSessionStore sessionStore;
    private final Clock clock;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    @Override
    public Set<ConversationState> handledStates() {
        return EnumSet.of(ConversationState.INCOME_AWAITING_AMOUNT);
    }

    public void start(IncomingEvent event) {
        if (!ledgerService.userExists(event.getSenderId())) {
            throw new NotRegisteredException(event.getSenderId());
        }
        sessionStore.start(event.getSenderId(), ConversationState.INCOME_AWAITING_AMOUNT);
        messageSender.send(event.getChatId(), "Введіть суму доходу (наприклад 250.50):");
    }

    @Override
    public void handleStep(IncomingEvent event, ConversationSession session) {
        BigDecimal amount = InputParsers.parseAmount(event.getPayload());

        ledgerService.recordIncome(event.getSenderId(), amount, LocalDateTime.now(clock));
        sessionStore.clear(event.getSenderId());

        messageSender.send(event.getChatId(), "Додано до доходів: " + amount.toPlainString(),
                MenuKeyboards.mainMenu());
    }
}
