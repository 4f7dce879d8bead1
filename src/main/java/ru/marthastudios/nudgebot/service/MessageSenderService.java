package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.bot.BotConvoResumeManager;
import ru.marthastudios.nudgebot.entity.BatchQueueItem;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.pojo.ConversationResumeResult;
import ru.marthastudios.nudgebot.pojo.MessageSendResult;

@Service
@RequiredArgsConstructor
@Slf4j
public class MessageSenderService {
    private final BotConvoResumeManager botConvoResumeManager;
    private final MessageTemplateService messageTemplateService;

    public MessageSendResult sendMessage(BatchQueueItem queueItem) {
        try {
            log.info("Processing message for recipient {} in batch {}", queueItem.getRecipientUpn(), queueItem.getBatchId());

            ConversationResumeResult resumeResult = botConvoResumeManager.resumeConversation(queueItem.getRecipientUpn());

            switch (resumeResult.getStatus()) {
                case MESSAGE_SENT -> {
                    log.info("Successfully sent message to {}: {}", queueItem.getRecipientUpn(), resumeResult.getMessage());

                    messageTemplateService.updateMessageLogStatus(queueItem.getMessageLogId(), MessageLogStatus.SUCCESS);

                    return buildResult(queueItem, true, null);
                }
                case APP_INSTALLED_PENDING -> {
                    // Stays PENDING; the card goes out when Teams reports the new conversation.
                    log.info("Bot app installed for {}. Message will be sent when user opens Teams.", queueItem.getRecipientUpn());

                    return buildResult(queueItem, true, null);
                }
                default -> {
                    log.warn("Failed to send message to {}: {}", queueItem.getRecipientUpn(), resumeResult.getMessage());

                    messageTemplateService.updateMessageLogStatus(queueItem.getMessageLogId(), MessageLogStatus.FAILED, resumeResult.getMessage());

                    return buildResult(queueItem, false, resumeResult.getMessage());
                }
            }
        } catch (Exception e) {
            log.error("Error sending message to {}", queueItem.getRecipientUpn(), e);

            messageTemplateService.updateMessageLogStatus(queueItem.getMessageLogId(), MessageLogStatus.FAILED, e.getMessage());

            return buildResult(queueItem, false, e.getMessage());
        }
    }

    private static MessageSendResult buildResult(BatchQueueItem queueItem, boolean success, String errorMessage) {
        return MessageSendResult.builder()
                .success(success)
                .messageLogId(queueItem.getMessageLogId())
                .recipientUpn(queueItem.getRecipientUpn())
                .errorMessage(errorMessage)
                .build();
    }
}
