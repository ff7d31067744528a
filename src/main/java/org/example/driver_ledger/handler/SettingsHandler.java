package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Кнопка "⚙️ Налаштування": язык и периодичность отчётов.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettingsHandler {

    private static final Set<String> LANGUAGES = Set.of("uk");
    private static final Set<String> REPORT_PERIODS = Set.of("weekly", "monthly");

    private final LedgerService ledgerService;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    public void showSettings(IncomingEvent event) {
        if (!ledgerService.userExists(event.getSenderId())) {
            throw new NotRegisteredException(event.getSenderId());
        }
        messageSender.send(event.getChatId(), "Налаштування:", MenuKeyboards.settings());
    }

    /**
     * callback "setlang:uk"
     */
    public void handleLanguage(IncomingEvent event, String lang) {
        if (!LANGUAGES.contains(lang)) {
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }
        requireRegistered(event);
        ledgerService.updateLanguage(event.getSenderId(), lang);
        log.info("Язык изменён: telegramId={}, lang={}", event.getSenderId(), lang);
        messageSender.send(event.getChatId(), "Мову збережено.");
    }

    /**
     * callback "setperiod:weekly" / "setperiod:monthly"
     */
    public void handleReportPeriod(IncomingEvent event, String period) {
        if (!REPORT_PERIODS.contains(period)) {
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }
        requireRegistered(event);
        ledgerService.updateReportPeriod(event.getSenderId(), period);
        log.info("Период отчётов изменён: telegramId={}, period={}", event.getSenderId(), period);
        messageSender.send(event.getChatId(), "Період звітів змінено.");
    }

    private void requireRegistered(IncomingEvent event) {
        if (!ledgerService.userExists(event.getSenderId())) {
            throw new NotRegisteredException(event.getSenderId());
        }
    }
}
