package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Команды /start, /cancel, /help.
 *
 * К моменту вызова UpdateDispatcher уже сбросил текущий диалог пользователя.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartCommandHandler {

    public static final String START = "/start";
    public static final String CANCEL = "/cancel";
    public static final String HELP = "/help";

    private final LedgerService ledgerService;
    private final RegistrationHandler registrationHandler;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    public static boolean isCommand(String command) {
        return START.equals(command) || CANCEL.equals(command) || HELP.equals(command);
    }

    public void handle(IncomingEvent event, String command) {
        switch (command) {
            case START:
                handleStart(event);
                break;
            case CANCEL:
                handleCancel(event);
                break;
            case HELP:
                handleHelp(event);
                break;
            default:
                throw new IllegalArgumentException("Неизвестная команда: " + command);
        }
    }

    /**
     * /start: зарегистрированного встречаем меню, нового - ведём в регистрацию.
     */
    private void handleStart(IncomingEvent event) {
        Long telegramId = event.getSenderId();
        log.info("Обработка команды /start: telegramId={}", telegramId);

        if (ledgerService.userExists(telegramId)) {
            String name = event.getSenderFirstName() != null ? event.getSenderFirstName() : "водію";
            messageSender.send(event.getChatId(), "З поверненням, " + name + "!", MenuKeyboards.mainMenu());
            return;
        }
        registrationHandler.startRegistration(event);
    }

    private void handleCancel(IncomingEvent event) {
        if (ledgerService.userExists(event.getSenderId())) {
            messageSender.send(event.getChatId(), "Дію скасовано.", MenuKeyboards.mainMenu());
        } else {
            messageSender.send(event.getChatId(), "Дію скасовано. Надішліть /start щоб зареєструватися.");
        }
    }

    private void handleHelp(IncomingEvent event) {
        messageSender.send(event.getChatId(),
                "Я допомагаю вести облік заробітку та витрат.\n\n" +
                        "/start — реєстрація або головне меню\n" +
                        "/cancel — скасувати поточну дію\n" +
                        "/help — ця довідка\n\n" +
                        "Решта — через кнопки меню.");
    }
}
