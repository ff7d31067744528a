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
import org.example.driver_ledger.exception.DuplicateNicknameException;
import org.example.driver_ledger.model.RegistrationDraft;
import org.example.driver_ledger.service.InputParsers;
import org.example.driver_ledger.service.LedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Пошаговая регистрация водителя.
 *
 * Управляет диалогом:
 * 1. /start (новый юзер) → спрашиваем настоящее имя
 * 2. Имя → спрашиваем псевдоним (уникальный, потом не меняется)
 * 3. Псевдоним → спрашиваем марку и модель авто
 * 4. Авто → спрашиваем номер, нормализуем, проверяем → сохраняем водителя
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationHandler implements ConversationStepHandler {

    private final LedgerService ledgerService;
    private final ConversationSessionStore sessionStore;

    // @Lazy - разрываем цикл Bot → UpdateDispatcher → обработчики → Bot
    @Autowired
    @Lazy
    private MessageSender messageSender;

    @Override
    public Set<ConversationState> handledStates() {
        return EnumSet.of(
                ConversationState.REGISTRATION_AWAITING_NAME,
                ConversationState.REGISTRATION_AWAITING_NICKNAME,
                ConversationState.REGISTRATION_AWAITING_CAR_MODEL,
                ConversationState.REGISTRATION_AWAITING_PLATE);
    }

    /**
     * Начать регистрацию (вызывается из StartCommandHandler для нового юзера).
     */
    public void startRegistration(IncomingEvent event) {
        log.info("Начало регистрации водителя: telegramId={}", event.getSenderId());
        sessionStore.start(event.getSenderId(), ConversationState.REGISTRATION_AWAITING_NAME);
        messageSender.send(event.getChatId(), "Вітаю! Щоб почати, введіть ваше справжнє ім'я:");
    }

    @Override
    public void handleStep(IncomingEvent event, ConversationSession session) {
        String text = event.getPayload();

        log.debug("Шаг регистрации: telegramId={}, state={}", event.getSenderId(), session.getState());

        switch (session.getState()) {
            case REGISTRATION_AWAITING_NAME:
                handleName(event, session, text);
                break;
            case REGISTRATION_AWAITING_NICKNAME:
                handleNickname(event, session, text);
                break;
            case REGISTRATION_AWAITING_CAR_MODEL:
                handleCarModel(event, session, text);
                break;
            case REGISTRATION_AWAITING_PLATE:
                handlePlate(event, session, text);
                break;
            default:
                throw new IllegalStateException("Не шаг регистрации: " + session.getState());
        }
    }

    private void handleName(IncomingEvent event, ConversationSession session, String text) {
        String name = InputParsers.requireText(text, "Ім'я не може бути порожнім. Введіть ваше ім'я:");
        session.advance(SessionField.NAME, name, ConversationState.REGISTRATION_AWAITING_NICKNAME);
        messageSender.send(event.getChatId(), "Придумайте унікальний псевдонім (він буде незмінний):");
    }

    private void handleNickname(IncomingEvent event, ConversationSession session, String text) {
        String nickname = InputParsers.requireText(text, "Псевдонім не може бути порожнім. Введіть псевдонім:");
        if (ledgerService.nicknameTaken(nickname)) {
            log.debug("Псевдоним занят: telegramId={}, nickname={}", event.getSenderId(), nickname);
            throw new DuplicateNicknameException(nickname);
        }
        session.advance(SessionField.NICKNAME, nickname, ConversationState.REGISTRATION_AWAITING_CAR_MODEL);
        messageSender.send(event.getChatId(), "Вкажіть марку та модель авто (наприклад Renault Logan):");
    }

    private void handleCarModel(IncomingEvent event, ConversationSession session, String text) {
        String carModel = InputParsers.requireText(text, "Вкажіть марку та модель авто:");
        session.advance(SessionField.CAR_MODEL, carModel, ConversationState.REGISTRATION_AWAITING_PLATE);
        messageSender.send(event.getChatId(), "Вкажіть номер автомобіля (наприклад BC1234AB):");
    }

    /**
     * Последний шаг: номер авто. Если номер ок - сохраняем водителя одним upsert'ом.
     */
    private void handlePlate(IncomingEvent event, ConversationSession session, String text) {
        String plate = InputParsers.parsePlate(text);

        RegistrationDraft draft = RegistrationDraft.builder()
                .name(session.get(SessionField.NAME).orElseThrow())
                .nickname(session.get(SessionField.NICKNAME).orElseThrow())
                .carModel(session.get(SessionField.CAR_MODEL).orElseThrow())
                .carNumber(plate)
                .build();

        try {
            ledgerService.saveUser(event.getSenderId(), event.getSenderFirstName(), draft);
        } catch (DuplicateNicknameException e) {
            // Псевдоним успел занять кто-то другой, пока юзер вводил авто
            sessionStore.clear(event.getSenderId());
            messageSender.send(event.getChatId(),
                    "Псевдонім «" + e.getNickname() + "» щойно зайняв інший водій. Почніть реєстрацію заново: /start");
            return;
        }

        sessionStore.clear(event.getSenderId());
        messageSender.send(event.getChatId(), "✅ Реєстрацію завершено!", MenuKeyboards.mainMenu());
    }
}
