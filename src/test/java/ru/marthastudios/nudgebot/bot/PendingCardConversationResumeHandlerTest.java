package ru.marthastudios.nudgebot.bot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;
import ru.marthastudios.nudgebot.dto.botframework.HeroCardDto;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.pojo.ResumedConversation;
import ru.marthastudios.nudgebot.service.MessageTemplateService;
import ru.marthastudios.nudgebot.service.PendingCardLookupService;
import ru.marthastudios.nudgebot.util.AdaptiveCardUtils;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PendingCardConversationResumeHandlerTest {
    @Mock
    private PendingCardLookupService pendingCardLookupService;
    @Mock
    private MessageTemplateService messageTemplateService;
    @InjectMocks
    private PendingCardConversationResumeHandler handler;

    @Test
    void returnsPendingCardAndMarksItDelivered() {
        AttachmentDto attachment = AdaptiveCardUtils.toAttachment("{\"type\":\"AdaptiveCard\"}");
        PendingCardInfo pendingCard = PendingCardInfo.builder()
                .messageLogId("log-1")
                .templateName("Copilot tips")
                .cardAttachment(attachment)
                .build();

        when(pendingCardLookupService.getLatestPendingCardByUpn("alice@contoso.com")).thenReturn(pendingCard);

        ResumedConversation<PendingCardInfo> resumed = handler.loadDataAndResumeConversation("alice@contoso.com");

        assertSame(pendingCard, resumed.getData());
        assertSame(attachment, resumed.getAttachment());
        verify(messageTemplateService).updateMessageLogStatus("log-1", MessageLogStatus.SUCCESS);
    }

    @Test
    void returnsWelcomeCardWhenNothingPending() {
        when(pendingCardLookupService.getLatestPendingCardByUpn("bob@contoso.com")).thenReturn(null);

        ResumedConversation<PendingCardInfo> resumed = handler.loadDataAndResumeConversation("bob@contoso.com");

        assertNull(resumed.getData());
        assertEquals(AttachmentDto.HERO_CARD_CONTENT_TYPE, resumed.getAttachment().getContentType());

        HeroCardDto heroCard = (HeroCardDto) resumed.getAttachment().getContent();

        assertEquals("Welcome!", heroCard.getTitle());
        assertTrue(heroCard.getText().contains("bob@contoso.com"));
        verify(messageTemplateService, never()).updateMessageLogStatus(any(), any());
    }
}
