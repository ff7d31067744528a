package org.example.driver_ledger;

import lombok.extern.slf4j.Slf4j;
import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.KeyboardLayout;
import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.bot.OutgoingMessage;
import org.example.driver_ledger.config.BotConfig;
import org.example.driver_ledger.handler.UpdateDispatcher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * Главный класс бота - слушает Telegram и отвечает.
 *
 * TelegramLongPollingBot - бот постоянно спрашивает у Telegram: "Есть новые сообщения?"
 *
 * Сам бот ничего не решает:
 * - входящий Update превращает в IncomingEvent и отдаёт UpdateDispatcher
 * - исходящие OutgoingMessage превращает в SendMessage с нужной клавиатурой
 */
@Slf4j
@Component
public class Bot extends TelegramLongPollingBot implements MessageSender {

    private final BotConfig botConfig;
    private final UpdateDispatcher updateDispatcher;

    public Bot(BotConfig botConfig, UpdateDispatcher updateDispatcher) {
        super(BotConfig.requireToken(botConfig.getToken()));
        this.botConfig = botConfig;
        this.updateDispatcher = updateDispatcher;
    }

    /**
     * Вызывается КАЖДЫЙ РАЗ когда приходит новое сообщение или нажатие кнопки.
     * Всё, что не текст и не кнопка (фото, стикеры...), игнорируем.
     */
    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery callbackQuery = update.getCallbackQuery();
            // Сообщение под кнопкой может быть уже недоступно (слишком старое) - тогда пишем в личку
            boolean hasSource = callbackQuery.getMessage() != null;
            updateDispatcher.dispatch(IncomingEvent.callback(
                    callbackQuery.getFrom().getId(),
                    hasSource ? callbackQuery.getMessage().getChatId() : callbackQuery.getFrom().getId(),
                    callbackQuery.getData(),
                    callbackQuery.getId(),
                    hasSource ? callbackQuery.getMessage().getMessageId() : null));
            return;
        }

        if (update.hasMessage() && update.getMessage().hasText()) {
            Message message = update.getMessage();
            updateDispatcher.dispatch(IncomingEvent.text(
                    message.getFrom().getId(),
                    message.getChatId(),
                    message.getText(),
                    message.getFrom().getFirstName()));
            return;
        }

        log.debug("Пропускаем update без текста и кнопки: updateId={}", update.getUpdateId());
    }

    @Override
    public void send(OutgoingMessage outgoing) {
        SendMessage message = SendMessage.builder()
                .chatId(outgoing.chatId().toString())
                .text(outgoing.text())
                .replyMarkup(outgoing.hasKeyboard() ? toMarkup(outgoing.keyboard()) : null)
                .build();
        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Ошибка отправки сообщения: chatId={}", outgoing.chatId(), e);
        }
    }

    @Override
    public void answerCallback(String callbackId) {
        try {
            execute(AnswerCallbackQuery.builder().callbackQueryId(callbackId).build());
        } catch (TelegramApiException e) {
            log.error("Ошибка ответа на callback query: callbackId={}", callbackId, e);
        }
    }

    @Override
    public void deleteMessage(Long chatId, Integer messageId) {
        if (messageId == null) {
            return;
        }
        try {
            execute(new DeleteMessage(chatId.toString(), messageId));
        } catch (TelegramApiException e) {
            log.error("Ошибка удаления сообщения: chatId={}, messageId={}", chatId, messageId, e);
        }
    }

    /**
     * KeyboardLayout → клавиатура Telegram.
     */
    private ReplyKeyboard toMarkup(KeyboardLayout layout) {
        if (layout.type() == KeyboardLayout.Type.REPLY_MENU) {
            List<KeyboardRow> rows = new ArrayList<>();
            for (List<KeyboardLayout.Button> buttons : layout.rows()) {
                KeyboardRow row = new KeyboardRow();
                buttons.forEach(b -> row.add(b.label()));
                rows.add(row);
            }
            ReplyKeyboardMarkup keyboard = new ReplyKeyboardMarkup();
            keyboard.setKeyboard(rows);
            keyboard.setResizeKeyboard(true);   // Подогнать размер под текст
            keyboard.setOneTimeKeyboard(false); // НЕ скрывать после нажатия
            return keyboard;
        }

        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (List<KeyboardLayout.Button> buttons : layout.rows()) {
            List<InlineKeyboardButton> row = new ArrayList<>();
            for (KeyboardLayout.Button b : buttons) {
                row.add(InlineKeyboardButton.builder()
                        .text(b.label())
                        .callbackData(b.callbackData())
                        .build());
            }
            rows.add(row);
        }
        return new InlineKeyboardMarkup(rows);
    }

    /**
     * Имя бота (username без @).
     */
    @Override
    public String getBotUsername() {
        return botConfig.getUsername();
    }
}
