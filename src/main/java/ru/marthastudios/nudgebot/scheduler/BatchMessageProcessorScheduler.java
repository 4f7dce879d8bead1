package ru.marthastudios.nudgebot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.entity.BatchQueueItem;
import ru.marthastudios.nudgebot.pojo.MessageSendResult;
import ru.marthastudios.nudgebot.property.NudgeProperty;
import ru.marthastudios.nudgebot.service.BatchQueueService;
import ru.marthastudios.nudgebot.service.MessageSenderService;

@Component
@RequiredArgsConstructor
@Slf4j
public class BatchMessageProcessorScheduler {
    private final BatchQueueService batchQueueService;
    private final MessageSenderService messageSenderService;
    private final NudgeProperty nudgeProperty;

    @Scheduled(fixedDelayString = "${nudge.queue.poll-interval-ms:5000}")
    public void handleQueuedMessages() {
        int processed = 0;

        try {
            while (processed < nudgeProperty.getMaxMessagesPerPoll()) {
                BatchQueueItem queueItem = batchQueueService.dequeueMessage();

                if (queueItem == null) {
                    break;
                }

                MessageSendResult result = messageSenderService.sendMessage(queueItem);

                if (!result.isSuccess()) {
                    log.warn("Message {} to {} failed: {}", result.getMessageLogId(), result.getRecipientUpn(), result.getErrorMessage());
                }

                // Processed either way; a failed send is recorded on its log, not retried.
                batchQueueService.deleteMessage(queueItem);

                processed++;
            }
        } catch (Exception e) {
            log.error("Error processing batch message queue", e);
        }

        if (processed > 0) {
            log.info("Processed {} queued message(s)", processed);
        }
    }
}
