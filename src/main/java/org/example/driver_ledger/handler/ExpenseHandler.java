package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.conversation.ConversationSession;
import org.example.driver_ledger.conversation.ConversationSessionStore;
import org.example.driver_ledger.conversation.ConversationState;
import org.example.driver_ledger.conversation.Flow;
import org.example.driver_ledger.conversation.SessionField;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.model.ExpenseCategory;
import org.example.driver_ledger.service.InputParsers;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Кнопка "💸 Додати витрати".
 *
 * 1. Ввод суммы (текст)
 * 2. Выбор категории (inline-кнопки exp_type:fuel / wash / repair / other)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpenseHandler implements ConversationStepHandler {

    private final LedgerService ledgerService;
    private final ConversationSessionStore sessionStore;
    private final Clock clock;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    @Override
    public Set<ConversationState> handledStates() {
        return EnumSet.of(ConversationState.EXPENSE_AWAITING_AMOUNT);
    }

    public void start(IncomingEvent event) {
        if (!ledgerService.userExists(event.getSenderId())) {
            throw new NotRegisteredException(event.getSenderId());
        }
        sessionStore.start(event.getSenderId(), ConversationState.EXPENSE_AWAITING_AMOUNT);
        messageSender.send(event.getChatId(), "Введіть суму витрати (наприклад 50.00):");
    }

    /**
     * Шаг суммы. Категорию выбирают кнопкой - см. handleCategory().
     */
    @Override
    public void handleStep(IncomingEvent event, ConversationSession session) {
        BigDecimal amount = InputParsers.parseAmount(event.getPayload());
        session.advance(SessionField.AMOUNT, amount.toPlainString(), ConversationState.EXPENSE_AWAITING_CATEGORY);
        messageSender.send(event.getChatId(), "Оберіть тип витрати:", MenuKeyboards.expenseCategories());
    }

    /**
     * Нажата кнопка категории (callback "exp_type:код").
     *
     * @param categoryCode часть callback_data после двоеточия
     */
    public void handleCategory(IncomingEvent event, String categoryCode) {
        Long telegramId = event.getSenderId();
        Optional<ConversationSession> sessionOpt = sessionStore.find(telegramId);

        if (sessionOpt.isPresent() && sessionOpt.get().getState().getFlow() != Flow.ADD_EXPENSE) {
            // Старая кнопка посреди другого диалога - чужой диалог не трогаем
            log.debug("Категория вне диалога расхода: telegramId={}, state={}",
                    telegramId, sessionOpt.get().getState());
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }

        Optional<String> amountText = sessionOpt
                .filter(s -> s.isIn(ConversationState.EXPENSE_AWAITING_CATEGORY))
                .flatMap(s -> s.get(SessionField.AMOUNT));
        if (amountText.isEmpty()) {
            log.debug("Категория без суммы: telegramId={}, category={}", telegramId, categoryCode);
            sessionStore.clear(telegramId);
            messageSender.send(event.getChatId(), "Не знайдено суму. Почніть заново.");
            return;
        }

        Optional<ExpenseCategory> category = ExpenseCategory.fromCode(categoryCode);
        if (category.isEmpty()) {
            // Сумму не теряем - можно нажать нормальную кнопку
            log.warn("Неизвестная категория расхода: telegramId={}, category={}", telegramId, categoryCode);
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }

        BigDecimal amount = new BigDecimal(amountText.get());
        ledgerService.recordExpense(telegramId, amount, category.get(), LocalDateTime.now(clock));
        sessionStore.clear(telegramId);

        messageSender.send(event.getChatId(),
                "Додано витрату " + amount.toPlainString() + " (" + category.get().getCode() + ")",
                MenuKeyboards.mainMenu());
    }
}
