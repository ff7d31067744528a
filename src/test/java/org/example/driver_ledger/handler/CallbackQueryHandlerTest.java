package org.example.driver_ledger.handler;

import org.example.driver_ledger.bot.IncomingEvent;
import org.example.driver_ledger.bot.MessageSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("CallbackQueryHandler Unit Tests")
class CallbackQueryHandlerTest {

    private static final Long USER = 7L;
    private static final Long CHAT = 70L;

    @Mock
    private ExpenseHandler expenseHandler;

    @Mock
    private ProfileHandler profileHandler;

    @Mock
    private SettingsHandler settingsHandler;

    @Mock
    private MessageSender messageSender;

    private CallbackQueryHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CallbackQueryHandler(expenseHandler, profileHandler, settingsHandler);
        ReflectionTestUtils.setField(handler, "messageSender", messageSender);
    }

    private IncomingEvent press(String data) {
        return IncomingEvent.callback(USER, CHAT, data, "cb-9", 12);
    }

    @Test
    @DisplayName("Should route expense category with the value after the prefix")
    void shouldRouteExpenseCategory() {
        IncomingEvent event = press("exp_type:repair");

        handler.handle(event);

        verify(messageSender).answerCallback("cb-9");
        verify(expenseHandler).handleCategory(event, "repair");
    }

    @Test
    @DisplayName("Should route profile and settings prefixes")
    void shouldRouteProfileAndSettings() {
        IncomingEvent edit = press("edit:name");
        IncomingEvent lang = press("setlang:uk");
        IncomingEvent period = press("setperiod:weekly");

        handler.handle(edit);
        handler.handle(lang);
        handler.handle(period);

        verify(profileHandler).handleEditCallback(edit, "name");
        verify(settingsHandler).handleLanguage(lang, "uk");
        verify(settingsHandler).handleReportPeriod(period, "weekly");
    }

    @Test
    @DisplayName("Should answer unknown data with unknown action")
    void shouldRejectUnknownData() {
        handler.handle(press("garbage"));
        handler.handle(press("order:1"));

        verify(messageSender, times(2)).send(CHAT, "Невідома дія.");
        verifyNoInteractions(expenseHandler, profileHandler, settingsHandler);
    }

    @Test
    @DisplayName("Should not answer a callback without id")
    void shouldSkipAnswerWithoutId() {
        handler.handle(IncomingEvent.callback(USER, CHAT, "exp_type:fuel", null, null));

        verify(messageSender, never()).answerCallback(any());
    }
}
