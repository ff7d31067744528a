package org.example.driver_ledger.handler;

import org.example.driver_ledger.bot.MessageSender;
import org.example.driver_ledger.bot.OutgoingMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * MessageSender для тестов: ничего не шлёт, всё запоминает.
 */
class RecordingMessageSender implements MessageSender {

    private final List<OutgoingMessage> sent = new CopyOnWriteArrayList<>();
    private final List<String> answeredCallbacks = new CopyOnWriteArrayList<>();
    private final List<Integer> deletedMessages = new CopyOnWriteArrayList<>();

    @Override
    public void send(OutgoingMessage message) {
        sent.add(message);
    }

    @Override
    public void answerCallback(String callbackId) {
        answeredCallbacks.add(callbackId);
    }

    @Override
    public void deleteMessage(Long chatId, Integer messageId) {
        deletedMessages.add(messageId);
    }

    OutgoingMessage last() {
        if (sent.isEmpty()) {
            throw new AssertionError("Ни одного сообщения не отправлено");
        }
        return sent.get(sent.size() - 1);
    }

    String lastText() {
        return last().text();
    }

    List<String> texts() {
        return sent.stream().map(OutgoingMessage::text).collect(Collectors.toList());
    }

    List<String> getAnsweredCallbacks() {
        return answeredCallbacks;
    }

    List<Integer> getDeletedMessages() {
        return deletedMessages;
    }

    void reset() {
        sent.clear();
        answeredCallbacks.clear();
        deletedMessages.clear();
    }
}
