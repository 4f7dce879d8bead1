package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.marthastudios.nudgebot.entity.BatchQueueItem;
import ru.marthastudios.nudgebot.property.NudgeProperty;
import ru.marthastudios.nudgebot.repository.BatchQueueItemRepository;

import java.util.List;

/**
 * Work queue for nudge sends, stored in the {@code batch_queue} table. A dequeued item stays in the table
 * but is hidden for the visibility timeout, so an item whose processing crashed is picked up again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchQueueService {
    private final BatchQueueItemRepository batchQueueItemRepository;
    private final NudgeProperty nudgeProperty;

    public BatchQueueItem enqueueMessage(BatchQueueItem item) {
        prepareForEnqueue(item, System.currentTimeMillis());

        BatchQueueItem saved = batchQueueItemRepository.save(item);

        log.debug("Enqueued message for {} in batch {}", item.getRecipientUpn(), item.getBatchId());

        return saved;
    }

    @Transactional
    public List<BatchQueueItem> enqueueBatchMessages(List<BatchQueueItem> items) {
        long now = System.currentTimeMillis();

        items.forEach(item -> prepareForEnqueue(item, now));

        List<BatchQueueItem> saved = batchQueueItemRepository.saveAll(items);

        log.info("Enqueued {} messages", saved.size());

        return saved;
    }

    /**
     * Takes the oldest visible item and hides it for the visibility timeout. Returns null when the queue has
     * nothing visible.
     */
    public synchronized BatchQueueItem dequeueMessage() {
        long now = System.currentTimeMillis();

        BatchQueueItem item = batchQueueItemRepository.findFirstByVisibleAtLessThanEqualOrderByEnqueuedAtAscIdAsc(now);

        if (item == null) {
            return null;
        }

        item.setVisibleAt(now + nudgeProperty.getQueueVisibilityTimeoutMs());
        item.setDequeueCount(item.getDequeueCount() + 1);

        return batchQueueItemRepository.save(item);
    }

    public void deleteMessage(BatchQueueItem item) {
        if (batchQueueItemRepository.existsById(item.getId())) {
            batchQueueItemRepository.deleteById(item.getId());
        }
    }

    public long getQueueLength() {
        return batchQueueItemRepository.count();
    }

    private static void prepareForEnqueue(BatchQueueItem item, long now) {
        item.setEnqueuedAt(now);
        item.setVisibleAt(now);
        item.setDequeueCount(0);
    }
}
