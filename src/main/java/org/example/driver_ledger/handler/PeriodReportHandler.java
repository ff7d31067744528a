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
import org.example.driver_ledger.model.ExpenseEntry;
import org.example.driver_ledger.model.IncomeEntry;
import org.example.driver_ledger.model.PeriodReport;
import org.example.driver_ledger.service.InputParsers;
import org.example.driver_ledger.service.InputParsers.ReportPeriod;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Кнопка "📅 Звіт за період".
 *
 * Ждём строку "2025-01-01,2025-01-31" (обе даты включительно),
 * показываем все доходы и расходы за период и сальдо.
 * Даты принимаются только внутри этого диалога.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeriodReportHandler implements ConversationStepHandler {

    private final LedgerService ledgerService;
    private final ConversationSessionStore sessionStore;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    @Override
    public Set<ConversationState> handledStates() {
        return EnumSet.of(ConversationState.REPORT_AWAITING_PERIOD);
    }

    public void start(IncomingEvent event) {
        if (!ledgerService.userExists(event.getSenderId())) {
            throw new NotRegisteredException(event.getSenderId());
        }
        sessionStore.start(event.getSenderId(), ConversationState.REPORT_AWAITING_PERIOD);
        messageSender.send(event.getChatId(),
                "Введіть період у форматі YYYY-MM-DD,YYYY-MM-DD (наприклад 2025-01-01,2025-01-31):");
    }

    @Override
    public void handleStep(IncomingEvent event, ConversationSession session) {
        ReportPeriod period = InputParsers.parsePeriod(event.getPayload());

        PeriodReport report = ledgerService.entriesInRange(
                event.getSenderId(), period.start(), period.endExclusive());
        sessionStore.clear(event.getSenderId());

        messageSender.send(event.getChatId(), formatReport(period, report), MenuKeyboards.mainMenu());
    }

    private String formatReport(ReportPeriod period, PeriodReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Звіт за період ").append(period.from()).append(" — ").append(period.to()).append(":\n\n");

        sb.append("Доходи:\n");
        for (IncomeEntry income : report.incomes()) {
            sb.append("- ").append(MessageFormats.date(income.getTimestamp())).append(": ")
                    .append(MessageFormats.money(income.getAmount())).append("\n");
        }

        sb.append("\nВитрати:\n");
        for (ExpenseEntry expense : report.expenses()) {
            sb.append("- ").append(MessageFormats.date(expense.getTimestamp())).append(": ")
                    .append(expense.getCategory().getCode()).append(" ")
                    .append(MessageFormats.money(expense.getAmount())).append("\n");
        }

        sb.append("\nСальдо за період: ").append(MessageFormats.money(report.net()));
        return sb.toString();
    }
}
