package ru.marthastudios.nudgebot.bot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.marthastudios.nudgebot.api.BotFrameworkApi;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ActivityTypes;
import ru.marthastudios.nudgebot.dto.botframework.ChannelAccountDto;
import ru.marthastudios.nudgebot.dto.botframework.ConversationAccountDto;
import ru.marthastudios.nudgebot.property.BotProperty;
import ru.marthastudios.nudgebot.property.NudgeProperty;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TurnErrorHandlerTest {
    private BotFrameworkApi botFrameworkApi;
    private BotStateStore botStateStore;
    private BotProperty botProperty;
    private TurnErrorHandler turnErrorHandler;
    private TurnContext turnContext;

    @BeforeEach
    void setUp() {
        botFrameworkApi = mock(BotFrameworkApi.class);

        NudgeProperty nudgeProperty = new NudgeProperty();
        nudgeProperty.setStateIdleExpiryHours(1);

        botStateStore = new BotStateStore(nudgeProperty);
        botProperty = new BotProperty();
        turnErrorHandler = new TurnErrorHandler(botStateStore, botProperty);

        turnContext = new TurnContext(ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .channelId("msteams")
                .serviceUrl("https://smba.example")
                .from(ChannelAccountDto.builder().id("29:user").build())
                .recipient(ChannelAccountDto.builder().id("28:bot").build())
                .conversation(ConversationAccountDto.builder().id("conversation-1").build())
                .build(), botFrameworkApi);
    }

    @Test
    void sendsGenericMessagesAndTraceAndClearsConversationState() {
        botStateStore.setProperty("msteams/conversations/conversation-1", "MainDialogue.step", 1);

        turnErrorHandler.onTurnError(turnContext, new IllegalStateException("database down"));

        List<ActivityDto> sent = captureSent(3);

        assertEquals("Oops, something unexpected happened and I hit a problem.", sent.get(0).getText());
        assertEquals("Please check the error logged and try again.", sent.get(1).getText());

        ActivityDto trace = sent.get(2);

        assertEquals(ActivityTypes.TRACE, trace.getType());
        assertEquals(TurnErrorHandler.TRACE_NAME, trace.getName());
        assertEquals("database down", trace.getValue());
        assertEquals(TurnErrorHandler.TRACE_VALUE_TYPE, trace.getValueType());
        assertEquals(TurnErrorHandler.TRACE_LABEL, trace.getLabel());

        assertNull(botStateStore.getProperty("msteams/conversations/conversation-1", "MainDialogue.step", Integer.class));
    }

    @Test
    void verboseModeSendsExceptionDetails() {
        botProperty.setVerboseErrors(true);

        turnErrorHandler.onTurnError(turnContext, new IllegalStateException("database down"));

        List<ActivityDto> sent = captureSent(3);

        assertTrue(sent.get(0).getText().contains("database down"));
        assertTrue(sent.get(1).getText().contains("IllegalStateException"));
    }

    @Test
    void sendFailuresNeverPropagate() {
        when(botFrameworkApi.sendToConversation(any(), any(), any())).thenThrow(new IllegalStateException("no token"));

        assertDoesNotThrow(() -> turnErrorHandler.onTurnError(turnContext, new RuntimeException("original")));

        // first message fails, then the trace attempt
        verify(botFrameworkApi, times(2)).sendToConversation(any(), any(), any());
    }

    private List<ActivityDto> captureSent(int expectedCount) {
        ArgumentCaptor<ActivityDto> captor = ArgumentCaptor.forClass(ActivityDto.class);

        verify(botFrameworkApi, times(expectedCount)).sendToConversation(any(), any(), captor.capture());

        return captor.getAllValues();
    }
}
