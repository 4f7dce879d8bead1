package ru.marthastudios.nudgebot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.marthastudios.nudgebot.api.BotFrameworkApi;
import ru.marthastudios.nudgebot.bot.ConversationResumeHandler;
import ru.marthastudios.nudgebot.bot.TurnContext;
import ru.marthastudios.nudgebot.bot.TurnErrorHandler;
import ru.marthastudios.nudgebot.bot.dialogue.MainDialogue;
import ru.marthastudios.nudgebot.dto.botframework.*;
import ru.marthastudios.nudgebot.pojo.BotUser;
import ru.marthastudios.nudgebot.pojo.CachedUserAndConversationData;
import ru.marthastudios.nudgebot.pojo.MainDialogueConvoState;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.pojo.ResumedConversation;
import ru.marthastudios.nudgebot.property.BotProperty;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TeamsBotServiceTest {
    private BotFrameworkApi botFrameworkApi;
    private BotConversationCache botConversationCache;
    private ConversationResumeHandler<PendingCardInfo> conversationResumeHandler;
    private MainDialogue mainDialogue;
    private TurnErrorHandler turnErrorHandler;
    private TeamsBotService teamsBotService;

    private final CachedUserAndConversationData aliceCached = CachedUserAndConversationData.builder()
            .azureAdId("aad-alice")
            .userPrincipalName("alice@contoso.com")
            .serviceUrl("https://smba.example")
            .conversationId("conversation-1")
            .build();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        botFrameworkApi = mock(BotFrameworkApi.class);
        botConversationCache = mock(BotConversationCache.class);
        conversationResumeHandler = mock(ConversationResumeHandler.class);
        mainDialogue = mock(MainDialogue.class);
        turnErrorHandler = mock(TurnErrorHandler.class);

        BotProperty botProperty = new BotProperty();
        botProperty.setName("Office Nudge");

        teamsBotService = new TeamsBotService(botFrameworkApi, botConversationCache, conversationResumeHandler,
                mainDialogue, turnErrorHandler, botProperty);
    }

    private static ActivityDto membersAdded(ChannelAccountDto... members) {
        return ActivityDto.builder()
                .type(ActivityTypes.CONVERSATION_UPDATE)
                .id("activity-1")
                .channelId("msteams")
                .serviceUrl("https://smba.example")
                .from(ChannelAccountDto.builder().id("29:alice").aadObjectId("aad-alice").build())
                .recipient(ChannelAccountDto.builder().id("28:bot").build())
                .conversation(ConversationAccountDto.builder().id("conversation-1").build())
                .membersAdded(List.of(members))
                .build();
    }

    private static ChannelAccountDto alice() {
        return ChannelAccountDto.builder().id("29:alice").aadObjectId("aad-alice").build();
    }

    private List<ActivityDto> captureSent(int times) {
        ArgumentCaptor<ActivityDto> captor = ArgumentCaptor.forClass(ActivityDto.class);

        verify(botFrameworkApi, times(times)).sendToConversation(eq("https://smba.example"), eq("conversation-1"), captor.capture());

        return captor.getAllValues();
    }

    @Test
    void messagesGoToMainDialogue() {
        ActivityDto message = ActivityDto.builder()
                .type(ActivityTypes.MESSAGE)
                .text("hello")
                .build();

        teamsBotService.onTurn(message);

        ArgumentCaptor<TurnContext> captor = ArgumentCaptor.forClass(TurnContext.class);

        verify(mainDialogue).run(captor.capture());
        assertSame(message, captor.getValue().getActivity());
        verifyNoInteractions(turnErrorHandler);
    }

    @Test
    void newUserGetsIntroductionAndPendingCard() {
        AttachmentDto pendingCard = AttachmentDto.builder()
                .contentType(AttachmentDto.ADAPTIVE_CARD_CONTENT_TYPE)
                .content("{}")
                .build();
        MainDialogueConvoState convoState = new MainDialogueConvoState();

        when(botConversationCache.getCachedUser("aad-alice")).thenReturn(null, aliceCached);
        when(conversationResumeHandler.loadDataAndResumeConversation("alice@contoso.com")).thenReturn(
                new ResumedConversation<>(PendingCardInfo.builder().templateName("Copilot tips").build(), pendingCard));
        when(mainDialogue.getConvoState("msteams/users/29:alice")).thenReturn(convoState);

        teamsBotService.onTurn(membersAdded(alice()));

        verify(botConversationCache).addConversationReferenceToCache(any(ActivityDto.class), any(BotUser.class));

        List<ActivityDto> sent = captureSent(2);

        AttachmentDto intro = sent.get(0).getAttachments().get(0);

        assertEquals(AttachmentDto.ADAPTIVE_CARD_CONTENT_TYPE, intro.getContentType());
        assertSame(pendingCard, sent.get(1).getAttachments().get(0));
        assertEquals("Copilot tips", convoState.getLastNudgeContext());
    }

    @Test
    void knownUserWithoutPendingCardGetsNothing() {
        when(botConversationCache.getCachedUser("aad-alice")).thenReturn(aliceCached);
        when(conversationResumeHandler.loadDataAndResumeConversation("alice@contoso.com")).thenReturn(
                new ResumedConversation<>(null, AttachmentDto.heroCard("Welcome!", "nothing")));

        teamsBotService.onTurn(membersAdded(alice()));

        verify(botConversationCache, never()).addConversationReferenceToCache(any(), any());
        verify(botFrameworkApi, never()).sendToConversation(any(), any(), any());
    }

    @Test
    void userThatCannotBeCachedIsSkipped() {
        when(botConversationCache.getCachedUser("aad-alice")).thenReturn(null);

        teamsBotService.onTurn(membersAdded(alice()));

        verify(botFrameworkApi, never()).sendToConversation(any(), any(), any());
        verifyNoInteractions(conversationResumeHandler);
    }

    @Test
    void botItselfIsIgnored() {
        teamsBotService.onTurn(membersAdded(ChannelAccountDto.builder().id("28:bot").build()));

        verifyNoInteractions(botConversationCache, conversationResumeHandler, botFrameworkApi);
    }

    @Test
    void anonymousUserIsWarned() {
        teamsBotService.onTurn(membersAdded(ChannelAccountDto.builder().id("29:guest").build()));

        List<ActivityDto> sent = captureSent(1);

        assertEquals("Hi, anonymous user. I only work with Azure AD users in Teams normally...", sent.get(0).getText());
    }

    @Test
    void failuresGoToTurnErrorHandler() {
        IllegalStateException failure = new IllegalStateException("boom");
        ActivityDto message = ActivityDto.builder().type(ActivityTypes.MESSAGE).text("hi").build();

        doThrow(failure).when(mainDialogue).run(any(TurnContext.class));

        teamsBotService.onTurn(message);

        verify(turnErrorHandler).onTurnError(any(TurnContext.class), eq(failure));
    }

    @Test
    void activitiesWithoutTypeAreIgnored() {
        teamsBotService.onTurn(ActivityDto.builder().text("?").build());

        verifyNoInteractions(mainDialogue, turnErrorHandler);
    }
}
