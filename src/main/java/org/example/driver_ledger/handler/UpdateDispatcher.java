package org.example.driver_ledger.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.conversation.ConversationSession;
import org.example.driver_ledger.conversation.ConversationSessionStore;
import org.example.driver_ledger.conversation.ConversationState;
import org.example.driver_ledger.conversation.UserLockRegistry;
import org.example.driver_ledger.exception.DuplicateNicknameException;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Маршрутизатор входящих событий - "мозг" бота.
 *
 * Порядок проверки:
 * 1. Команда (/start, /cancel, /help) - сбрасываем текущий диалог и выполняем
 * 2. Нажатие inline-кнопки - в CallbackQueryHandler
 * 3. Есть активный диалог - отдаём текст обработчику текущего шага (что бы там ни было написано)
 * 4. Кнопка главного меню
 * 5. Иначе - подсказка
 *
 * Все ошибки ловятся здесь и превращаются в сообщение пользователю.
 * Сообщения одного пользователя обрабатываются строго по очереди (UserLockRegistry).
 */
@Slf4j
@Component
public class UpdateDispatcher {

    private final ConversationSessionStore sessionStore;
    private final UserLockRegistry lockRegistry;
    private final StartCommandHandler startCommandHandler;
    private final CallbackQueryHandler callbackQueryHandler;
    private final IncomeHandler incomeHandler;
    private final ExpenseHandler expenseHandler;
    private final PeriodReportHandler periodReportHandler;
    private final StatsHandler statsHandler;
    private final ProfileHandler profileHandler;
    private final SettingsHandler settingsHandler;

    /** Какой обработчик отвечает за какой шаг диалога */
    private final Map<ConversationState, ConversationStepHandler> stepHandlers = new EnumMap<>(ConversationState.class);

    @Autowired
    @Lazy
    private MessageSender messageSender;

    public UpdateDispatcher(ConversationSessionStore sessionStore,
                            UserLockRegistry lockRegistry,
                            StartCommandHandler startCommandHandler,
                            CallbackQueryHandler callbackQueryHandler,
                            IncomeHandler incomeHandler,
                            ExpenseHandler expenseHandler,
                            PeriodReportHandler periodReportHandler,
                            StatsHandler statsHandler,
                            ProfileHandler profileHandler,
                            SettingsHandler settingsHandler,
                            List<ConversationStepHandler> handlers) {
        this.sessionStore = sessionStore;
        this.lockRegistry = lockRegistry;
        this.startCommandHandler = startCommandHandler;
        this.callbackQueryHandler = callbackQueryHandler;
        this.incomeHandler = incomeHandler;
        this.expenseHandler = expenseHandler;
        this.periodReportHandler = periodReportHandler;
        this.statsHandler = statsHandler;
        this.profileHandler = profileHandler;
        this.settingsHandler = settingsHandler;

        for (ConversationStepHandler handler : handlers) {
            for (ConversationState state : handler.handledStates()) {
                ConversationStepHandler previous = stepHandlers.put(state, handler);
                if (previous != null) {
                    throw new IllegalStateException("Два обработчика на одно состояние " + state + ": "
                            + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * Обработать одно входящее событие. Никогда не бросает исключений.
     */
    public void dispatch(IncomingEvent event) {
        if (event.getSenderId() == null) {
            log.warn("Событие без отправителя: {}", event);
            return;
        }
        lockRegistry.runExclusively(event.getSenderId(), () -> dispatchSafely(event));
    }

    private void dispatchSafely(IncomingEvent event) {
        Long telegramId = event.getSenderId();
        try {
            route(event);
        } catch (ValidationException | DuplicateNicknameException e) {
            // Неверный ввод - остаёмся на том же шаге, просим ещё раз
            log.debug("Неверный ввод: telegramId={}, reason={}", telegramId, e.getMessage());
            messageSender.send(event.getChatId(), e.getMessage());
        } catch (NotRegisteredException e) {
            log.debug("Действие без регистрации: telegramId={}", e.getUserId());
            messageSender.send(event.getChatId(), e.getMessage());
        } catch (DataAccessException e) {
            log.error("Ошибка БД при обработке события: telegramId={}", telegramId, e);
            failRequest(event);
        } catch (RuntimeException e) {
            log.error("Ошибка при обработке события: telegramId={}, event={}", telegramId, event, e);
            failRequest(event);
        }
    }

    private void route(IncomingEvent event) {
        if (event.isCallback()) {
            callbackQueryHandler.handle(event);
            return;
        }

        String text = event.getPayload() == null ? "" : event.getPayload().trim();
        Long telegramId = event.getSenderId();

        String command = extractCommand(text);
        if (command != null && StartCommandHandler.isCommand(command)) {
            sessionStore.clear(telegramId);
            startCommandHandler.handle(event, command);
            return;
        }

        Optional<ConversationSession> session = sessionStore.find(telegramId);
        if (session.isPresent()) {
            handleActiveStep(event, session.get());
            return;
        }

        switch (text) {
            case MenuKeyboards.ADD_INCOME:
                incomeHandler.start(event);
                break;
            case MenuKeyboards.ADD_EXPENSE:
                expenseHandler.start(event);
                break;
            case MenuKeyboards.MY_STATS:
                statsHandler.showMyStats(event);
                break;
            case MenuKeyboards.PERIOD_REPORT:
                periodReportHandler.start(event);
                break;
            case MenuKeyboards.TOP_DRIVERS:
                statsHandler.showTopDrivers(event);
                break;
            case MenuKeyboards.MY_CAR:
                profileHandler.showProfile(event);
                break;
            case MenuKeyboards.SETTINGS:
                settingsHandler.showSettings(event);
                break;
            default:
                messageSender.send(event.getChatId(),
                        "Не зрозумів. Скористайтеся кнопками меню або надішліть /start.");
        }
    }

    private void handleActiveStep(IncomingEvent event, ConversationSession session) {
        ConversationState state = session.getState();
        if (!state.expectsText()) {
            // Ждём нажатие кнопки, а пришёл текст
            messageSender.send(event.getChatId(), "👆 Оберіть варіант кнопкою під повідомленням.");
            return;
        }
        ConversationStepHandler handler = stepHandlers.get(state);
        if (handler == null) {
            throw new IllegalStateException("Нет обработчика для состояния " + state);
        }
        handler.handleStep(event, session);
    }

    /**
     * Сбой запроса: диалог сбрасываем, пользователю - общее сообщение.
     */
    private void failRequest(IncomingEvent event) {
        sessionStore.clear(event.getSenderId());
        messageSender.send(event.getChatId(), "❌ Сталася помилка. Спробуйте пізніше.");
    }

    /**
     * "/start@driver_ledger_bot payload" → "/start". Не команда → null.
     */
    static String extractCommand(String text) {
        if (!text.startsWith("/")) {
            return null;
        }
        String command = text.split("\\s+", 2)[0];
        int at = command.indexOf('@');
        return at > 0 ? command.substring(0, at) : command;
    }
}
