package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.marthastudios.nudgebot.entity.BatchQueueItem;
import ru.marthastudios.nudgebot.entity.MessageBatch;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.entity.MessageTemplate;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;
import ru.marthastudios.nudgebot.exception.ResourceNotFoundException;
import ru.marthastudios.nudgebot.repository.MessageBatchRepository;
import ru.marthastudios.nudgebot.repository.MessageLogRepository;
import ru.marthastudios.nudgebot.repository.MessageTemplateRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MessageTemplateService {
    private final MessageTemplateRepository messageTemplateRepository;
    private final MessageBatchRepository messageBatchRepository;
    private final MessageLogRepository messageLogRepository;
    private final BatchQueueService batchQueueService;

    // Templates

    @Transactional
    public MessageTemplate createTemplate(String templateName, String jsonPayload, String createdByUpn) {
        log.info("Creating template '{}' by {}", templateName, createdByUpn);

        MessageTemplate template = MessageTemplate.builder()
                .id(UUID.randomUUID().toString())
                .templateName(templateName)
                .jsonPayload(jsonPayload)
                .createdByUpn(createdByUpn)
                .createdDate(System.currentTimeMillis())
                .build();

        return messageTemplateRepository.save(template);
    }

    public List<MessageTemplate> getAllTemplates() {
        return messageTemplateRepository.findAllByOrderByCreatedDateDesc();
    }

    public MessageTemplate getTemplate(String templateId) {
        return messageTemplateRepository.findById(templateId).orElse(null);
    }

    public String getTemplateJson(String templateId) {
        return getExistingTemplate(templateId).getJsonPayload();
    }

    public long getTemplateCount() {
        return messageTemplateRepository.count();
    }

    @Transactional
    public MessageTemplate updateTemplate(String templateId, String templateName, String jsonPayload) {
        log.info("Updating template {}", templateId);

        MessageTemplate template = getExistingTemplate(templateId);

        template.setTemplateName(templateName);
        template.setJsonPayload(jsonPayload);

        return messageTemplateRepository.save(template);
    }

    @Transactional
    public void deleteTemplate(String templateId) {
        log.info("Deleting template {}", templateId);

        messageTemplateRepository.delete(getExistingTemplate(templateId));
    }

    private MessageTemplate getExistingTemplate(String templateId) {
        return messageTemplateRepository.findById(templateId)
                .orElseThrow(() -> new ResourceNotFoundException("Template " + templateId + " not found"));
    }

    // Batches

    @Transactional
    public MessageBatch createBatch(String batchName, String templateId, String senderUpn) {
        log.info("Creating batch '{}' for template {}", batchName, templateId);

        MessageBatch batch = MessageBatch.builder()
                .id(UUID.randomUUID().toString())
                .batchName(batchName)
                .templateId(templateId)
                .senderUpn(senderUpn)
                .createdDate(System.currentTimeMillis())
                .build();

        return messageBatchRepository.save(batch);
    }

    public List<MessageBatch> getAllBatches() {
        return messageBatchRepository.findAllByOrderByCreatedDateDesc();
    }

    public MessageBatch getBatch(String batchId) {
        return messageBatchRepository.findById(batchId).orElse(null);
    }

    @Transactional
    public void deleteBatch(String batchId) {
        log.info("Deleting batch {}", batchId);

        MessageBatch batch = messageBatchRepository.findById(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch " + batchId + " not found"));

        messageLogRepository.deleteAllByBatchId(batchId);
        messageBatchRepository.delete(batch);
    }

    // Logs

    @Transactional
    public MessageLog logMessageSend(String messageBatchId, String recipientUpn, MessageLogStatus status, String lastError) {
        MessageLog messageLog = buildLog(messageBatchId, recipientUpn, status, System.currentTimeMillis());

        messageLog.setLastError(lastError);

        return messageLogRepository.save(messageLog);
    }

    /**
     * Creates one pending log per recipient and queues each of them for sending.
     */
    @Transactional
    public List<MessageLog> logBatchMessages(String messageBatchId, List<String> recipientUpns) {
        MessageBatch batch = messageBatchRepository.findById(messageBatchId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch " + messageBatchId + " not found"));

        long now = System.currentTimeMillis();

        List<MessageLog> logs = new ArrayList<>();

        for (String recipientUpn : recipientUpns) {
            logs.add(buildLog(messageBatchId, recipientUpn, MessageLogStatus.PENDING, now));
        }

        List<MessageLog> savedLogs = messageLogRepository.saveAll(logs);

        List<BatchQueueItem> queueItems = new ArrayList<>();

        for (MessageLog savedLog : savedLogs) {
            queueItems.add(BatchQueueItem.builder()
                    .batchId(messageBatchId)
                    .messageLogId(savedLog.getId())
                    .recipientUpn(savedLog.getRecipientUpn() != null ? savedLog.getRecipientUpn() : "")
                    .templateId(batch.getTemplateId())
                    .build());
        }

        batchQueueService.enqueueBatchMessages(queueItems);

        log.info("Logged and queued {} messages for batch {}", savedLogs.size(), messageBatchId);

        return savedLogs;
    }

    /**
     * Missing logs are only warned about; a send can outlive a deleted batch.
     */
    @Transactional
    public void updateMessageLogStatus(String logId, MessageLogStatus status, String lastError) {
        MessageLog messageLog = messageLogRepository.findById(logId).orElse(null);

        if (messageLog == null) {
            log.warn("Message log {} not found, can't set status {}", logId, status);
            return;
        }

        messageLog.setStatus(status);
        messageLog.setLastError(lastError);

        messageLogRepository.save(messageLog);
    }

    public void updateMessageLogStatus(String logId, MessageLogStatus status) {
        updateMessageLogStatus(logId, status, null);
    }

    public List<MessageLog> getAllMessageLogs() {
        return messageLogRepository.findAllByOrderBySentDateDesc();
    }

    public List<MessageLog> getMessageLogsByBatch(String batchId) {
        return messageLogRepository.findAllByMessageBatchIdOrderBySentDateDesc(batchId);
    }

    public List<MessageLog> getMessageLogsByTemplate(String templateId) {
        List<String> batchIds = messageBatchRepository.findAllByTemplateId(templateId).stream()
                .map(MessageBatch::getId)
                .toList();

        if (batchIds.isEmpty()) {
            return new ArrayList<>();
        }

        return messageLogRepository.findAllByMessageBatchIdInOrderBySentDateDesc(batchIds);
    }

    private static MessageLog buildLog(String messageBatchId, String recipientUpn, MessageLogStatus status, long sentDate) {
        return MessageLog.builder()
                .id(UUID.randomUUID().toString())
                .messageBatchId(messageBatchId)
                .recipientUpn(recipientUpn)
                .status(status)
                .sentDate(sentDate)
                .build();
    }
}
