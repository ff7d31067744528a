package org.example.driver_ledger.bot;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Входящее событие в едином виде - без классов Telegram API.
 *
 * Bot собирает его из Update, дальше вся логика работает только с ним.
 * payload - текст сообщения или callback_data кнопки ("exp_type:fuel").
 */
@Getter
@Builder
@ToString
public class IncomingEvent {

    private final Long senderId;
    private final Long chatId;
    private final EventKind kind;
    private final String payload;

    /** first_name из профиля Telegram (может быть null) */
    private final String senderFirstName;

    /** ID callback query, чтобы ответить на нажатие (только для CALLBACK) */
    private final String callbackId;

    /** Сообщение, под которым нажата кнопка (только для CALLBACK) */
    private final Integer messageId;

    public boolean isCallback() {
        return kind == EventKind.CALLBACK;
    }

    public static IncomingEvent text(Long senderId, Long chatId, String text, String senderFirstName) {
        return IncomingEvent.builder()
                .senderId(senderId)
                .chatId(chatId)
                .kind(EventKind.TEXT)
                .payload(text)
                .senderFirstName(senderFirstName)
                .build();
    }

    public static IncomingEvent callback(Long senderId, Long chatId, String data, String callbackId, Integer messageId) {
        return IncomingEvent.builder()
                .senderId(senderId)
                .chatId(chatId)
                .kind(EventKind.CALLBACK)
                .payload(data)
                .callbackId(callbackId)
                .messageId(messageId)
                .build();
    }
}
