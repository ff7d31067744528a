package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.config.LedgerConfig;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.model.Balance;
import org.example.driver_ledger.model.LeaderboardEntry;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Кнопки "📊 Моя статистика" и "🏆 Топ водіїв" - только чтение, без диалога.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatsHandler {

    private final LedgerService ledgerService;
    private final LedgerConfig ledgerConfig;
    private final Clock clock;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    /**
     * Баланс за сутки, неделю, 30 дней и за всё время.
     */
    public void showMyStats(IncomingEvent event) {
        Long telegramId = event.getSenderId();
        if (!ledgerService.userExists(telegramId)) {
            throw new NotRegisteredException(telegramId);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Balance day = ledgerService.balanceSince(telegramId, now.minusDays(1));
        Balance week = ledgerService.balanceSince(telegramId, now.minusDays(7));
        Balance month = ledgerService.balanceSince(telegramId, now.minusDays(30));
        Balance total = ledgerService.balanceSince(telegramId, null);

        String text = "Баланс загальний: " + MessageFormats.money(total.net()) + "\n" +
                "Сьогодні: " + line(day) + "\n" +
                "Тиждень: " + line(week) + "\n" +
                "Місяць: " + line(month);

        messageSender.send(event.getChatId(), text, MenuKeyboards.mainMenu());
    }

    public void showTopDrivers(IncomingEvent event) {
        List<LeaderboardEntry> top = ledgerService.topByNetBalance(ledgerConfig.getLeaderboardSize());
        if (top.isEmpty()) {
            messageSender.send(event.getChatId(), "Поки що немає даних для рейтингу.");
            return;
        }

        StringBuilder sb = new StringBuilder("🏆 Топ водіїв:\n");
        for (int i = 0; i < top.size(); i++) {
            LeaderboardEntry entry = top.get(i);
            sb.append(i + 1).append(". ").append(entry.displayName())
                    .append(" (").append(entry.nickname()).append(") — ")
                    .append(MessageFormats.money(entry.net())).append("\n");
        }
        messageSender.send(event.getChatId(), sb.toString(), MenuKeyboards.mainMenu());
    }

    /** "+доходы -расходы = сальдо" */
    private static String line(Balance balance) {
        return "+" + MessageFormats.money(balance.totalIncome()) +
                " -" + MessageFormats.money(balance.totalExpense()) +
                " = " + MessageFormats.money(balance.net());
    }
}
