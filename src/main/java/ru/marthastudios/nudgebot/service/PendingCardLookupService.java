package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.entity.MessageBatch;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.entity.MessageTemplate;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.pojo.PendingCardInfo;
import ru.marthastudios.nudgebot.repository.MessageBatchRepository;
import ru.marthastudios.nudgebot.repository.MessageLogRepository;
import ru.marthastudios.nudgebot.repository.MessageTemplateRepository;
import ru.marthastudios.nudgebot.util.AdaptiveCardUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds nudges still waiting to be delivered to a user, newest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingCardLookupService {
    private final MessageLogRepository messageLogRepository;
    private final MessageBatchRepository messageBatchRepository;
    private final MessageTemplateRepository messageTemplateRepository;

    /**
     * Returns null when nothing is pending, when the newest pending log's batch or template is gone, or on
     * any lookup error.
     */
    public PendingCardInfo getLatestPendingCardByUpn(String upn) {
        try {
            log.info("Looking for pending cards for user {}", upn);

            List<MessageLog> pendingLogs = findPendingLogs(upn);

            if (pendingLogs.isEmpty()) {
                log.info("No pending cards found for user {}", upn);
                return null;
            }

            MessageLog latestLog = pendingLogs.get(0);

            log.info("Found pending card for user {}: log {}, batch {}", upn, latestLog.getId(), latestLog.getMessageBatchId());

            MessageBatch batch = messageBatchRepository.findById(latestLog.getMessageBatchId()).orElse(null);

            if (batch == null) {
                log.warn("Batch {} not found for pending card", latestLog.getMessageBatchId());
                return null;
            }

            MessageTemplate template = messageTemplateRepository.findById(batch.getTemplateId()).orElse(null);

            if (template == null) {
                log.warn("Template {} not found for pending card", batch.getTemplateId());
                return null;
            }

            return buildPendingCard(latestLog, batch, template, upn);
        } catch (Exception e) {
            log.error("Error looking up pending card for user {}", upn, e);
            return null;
        }
    }

    public List<PendingCardInfo> getAllPendingCardsByUpn(String upn) {
        List<PendingCardInfo> pendingCards = new ArrayList<>();

        try {
            log.info("Looking for all pending cards for user {}", upn);

            for (MessageLog pendingLog : findPendingLogs(upn)) {
                try {
                    MessageBatch batch = messageBatchRepository.findById(pendingLog.getMessageBatchId()).orElse(null);

                    if (batch == null) {
                        continue;
                    }

                    MessageTemplate template = messageTemplateRepository.findById(batch.getTemplateId()).orElse(null);

                    if (template == null) {
                        continue;
                    }

                    pendingCards.add(buildPendingCard(pendingLog, batch, template, upn));
                } catch (Exception e) {
                    log.warn("Error processing pending card for log {}", pendingLog.getId(), e);
                }
            }

            log.info("Found {} pending cards for user {}", pendingCards.size(), upn);
        } catch (Exception e) {
            log.error("Error looking up pending cards for user {}", upn, e);
        }

        return pendingCards;
    }

    private List<MessageLog> findPendingLogs(String upn) {
        return messageLogRepository.findAllByRecipientUpnIgnoreCaseAndStatusOrderBySentDateDesc(upn, MessageLogStatus.PENDING);
    }

    private static PendingCardInfo buildPendingCard(MessageLog messageLog, MessageBatch batch, MessageTemplate template, String upn) {
        return PendingCardInfo.builder()
                .messageLogId(messageLog.getId())
                .batchId(batch.getId())
                .templateId(template.getId())
                .templateName(template.getTemplateName())
                .cardJson(template.getJsonPayload())
                .cardAttachment(AdaptiveCardUtils.toAttachment(template.getJsonPayload()))
                .sentDate(messageLog.getSentDate())
                .recipientUpn(messageLog.getRecipientUpn() != null ? messageLog.getRecipientUpn() : upn)
                .build();
    }
}
