package ru.marthastudios.nudgebot.bot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.pojo.ResumedConversation;
import ru.marthastudios.nudgebot.service.MessageTemplateService;
import ru.marthastudios.nudgebot.service.PendingCardLookupService;

@Component
@RequiredArgsConstructor
@Slf4j
public class PendingCardConversationResumeHandler implements ConversationResumeHandler<PendingCardInfo> {
    private final PendingCardLookupService pendingCardLookupService;
    private final MessageTemplateService messageTemplateService;

    /**
     * Returns the newest pending card and marks it delivered. With nothing pending, returns a welcome hero
     * card and no data.
     */
    @Override
    public ResumedConversation<PendingCardInfo> loadDataAndResumeConversation(String chatUserUpn) {
        log.info("Looking for pending card for user {}", chatUserUpn);

        PendingCardInfo pendingCard = pendingCardLookupService.getLatestPendingCardByUpn(chatUserUpn);

        if (pendingCard != null) {
            log.info("Found pending card '{}' for user {}", pendingCard.getTemplateName(), chatUserUpn);

            messageTemplateService.updateMessageLogStatus(pendingCard.getMessageLogId(), MessageLogStatus.SUCCESS);

            log.info("Updated message log {} to SUCCESS", pendingCard.getMessageLogId());

            return new ResumedConversation<>(pendingCard, pendingCard.getCardAttachment());
        }

        log.info("No pending cards found for user {}, sending default welcome message", chatUserUpn);

        AttachmentDto welcomeCard = AttachmentDto.heroCard("Welcome!",
                "Hello " + chatUserUpn + ", you have no pending messages at this time.");

        return new ResumedConversation<>(null, welcomeCard);
    }
}
