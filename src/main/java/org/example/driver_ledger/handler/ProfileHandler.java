package org.example.driver_ledger.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MenuKeyboards;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.conversation.ConversationSession;
import org.example.driver_ledger.conversation.ConversationSessionStore;
import org.example.driver_ledger.conversation.ConversationState;
import org.example.driver_ledger.conversation.SessionField;
import org.example.driver_ledger.exception.NotRegisteredException;
import org.example.driver_ledger.model.User;
import org.example.driver_ledger.service.InputParsers;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Кнопка "🚘 Мій автомобіль": карточка водителя + редактирование.
 *
 * Псевдоним редактировать нельзя - только имя и авто (модель + номер).
 * callback_data: edit:name / edit:car / edit:close
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileHandler implements ConversationStepHandler {

    private final LedgerService ledgerService;
    private final ConversationSessionStore sessionStore;

    @Autowired
    @Lazy
    private MessageSender messageSender;

    @Override
    public Set<ConversationState> handledStates() {
        return EnumSet.of(
                ConversationState.EDIT_AWAITING_NAME,
                ConversationState.EDIT_AWAITING_CAR_MODEL,
                ConversationState.EDIT_AWAITING_PLATE);
    }

    public void showProfile(IncomingEvent event) {
        Optional<User> userOpt = ledgerService.findUser(event.getSenderId());
        if (userOpt.isEmpty()) {
            messageSender.send(event.getChatId(), "Ви ще не зареєстровані.");
            return;
        }
        User user = userOpt.get();
        String text = "👤 " + user.getName() + "\n" +
                "🏷️ " + user.getNickname() + "\n" +
                "🚘 " + user.getCarModel() + " (" + user.getCarNumber() + ")";
        messageSender.send(event.getChatId(), text, MenuKeyboards.profileActions());
    }

    /**
     * Нажата кнопка под карточкой.
     *
     * @param action часть callback_data после "edit:"
     */
    public void handleEditCallback(IncomingEvent event, String action) {
        Long telegramId = event.getSenderId();
        if ("close".equals(action)) {
            messageSender.deleteMessage(event.getChatId(), event.getMessageId());
            return;
        }
        if (!"name".equals(action) && !"car".equals(action)) {
            messageSender.send(event.getChatId(), "Невідома дія.");
            return;
        }
        if (!ledgerService.userExists(telegramId)) {
            throw new NotRegisteredException(telegramId);
        }

        if ("name".equals(action)) {
            sessionStore.start(telegramId, ConversationState.EDIT_AWAITING_NAME);
            messageSender.send(event.getChatId(), "Введіть нове ім'я:");
        } else {
            sessionStore.start(telegramId, ConversationState.EDIT_AWAITING_CAR_MODEL);
            messageSender.send(event.getChatId(), "Введіть нову марку та модель авто:");
        }
    }

    @Override
    public void handleStep(IncomingEvent event, ConversationSession session) {
        Long telegramId = event.getSenderId();
        String text = event.getPayload();

        switch (session.getState()) {
            case EDIT_AWAITING_NAME: {
                String name = InputParsers.requireText(text, "Ім'я не може бути порожнім. Введіть нове ім'я:");
                ledgerService.updateName(telegramId, name);
                sessionStore.clear(telegramId);
                messageSender.send(event.getChatId(), "✅ Ім'я оновлено.", MenuKeyboards.mainMenu());
                break;
            }
            case EDIT_AWAITING_CAR_MODEL: {
                String carModel = InputParsers.requireText(text, "Вкажіть марку та модель авто:");
                session.advance(SessionField.CAR_MODEL, carModel, ConversationState.EDIT_AWAITING_PLATE);
                messageSender.send(event.getChatId(), "Вкажіть номер автомобіля (наприклад BC1234AB):");
                break;
            }
            case EDIT_AWAITING_PLATE: {
                String plate = InputParsers.parsePlate(text);
                String carModel = session.get(SessionField.CAR_MODEL).orElseThrow();
                ledgerService.updateVehicle(telegramId, carModel, plate);
                sessionStore.clear(telegramId);
                messageSender.send(event.getChatId(), "✅ Дані авто оновлено: " + carModel + " (" + plate + ")",
                        MenuKeyboards.mainMenu());
                break;
            }
            default:
                throw new IllegalStateException("Не шаг редактирования: " + session.getState());
        }
    }
}
