package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Обработчик callback query - это когда пользователь нажимает на Inline кнопку.
 *
 * <h2>Формат callback_data:</h2>
 * {@code префикс:значение}, например:
 * <ul>
 *   <li>{@code exp_type:fuel} - категория расхода → ExpenseHandler</li>
 *   <li>{@code edit:name}, {@code edit:car}, {@code edit:close} → ProfileHandler</li>
 *   <li>{@code setlang:uk}, {@code setperiod:monthly} → SettingsHandler</li>
 * </ul>
 * Всё остальное - "Невідома дія.", текущий диалог не трогаем.
 *
 * <h2>Важно:</h2>
 * На callback ОБЯЗАТЕЛЬНО нужно ответить (answerCallback),
 * иначе кнопка будет "висеть" с часиками.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallbackQueryHandler {

    private final ExpenseHandler expenseHandler;
    private final ProfileHandler profileHandler;
    private final SettingsHandler settingsHandler;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    public void handle(IncomingEvent event) {
        String callbackData = event.getPayload();
        log.info("Обработка callback query: telegramId={}, callbackData={}", event.getSenderId(), callbackData);

        if (event.getCallbackId() != null) {
            messageSender.answerCallback(event.getCallbackId());
        }

        int separator = callbackData == null ? -1 : callbackData.indexOf(':');
        if (separator < 0) {
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }
        String prefix = callbackData.substring(0, separator);
        String value = callbackData.substring(separator + 1);

        switch (prefix) {
            case MenuKeyboards.EXPENSE_TYPE_PREFIX:
                expenseHandler.handleCategory(event, value);
                break;
            case MenuKeyboards.EDIT_PREFIX:
                profileHandler.handleEditCallback(event, value);
                break;
            case MenuKeyboards.SET_LANG_PREFIX:
                settingsHandler.handleLanguage(event, value);
                break;
            case MenuKeyboards.SET_PERIOD_PREFIX:
                settingsHandler.handleReportPeriod(event, value);
                break;
            default:
                log.warn("Неизвестный callback: telegramId={}, callbackData={}", event.getSenderId(), callbackData);
                messageSender.send(event.getChatId(), "Невідома дія.");
        }
    }
}
