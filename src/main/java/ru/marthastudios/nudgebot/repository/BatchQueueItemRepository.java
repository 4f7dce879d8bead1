package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.BatchQueueItem;

@Repository
public interface BatchQueueItemRepository extends JpaRepository<BatchQueueItem, Long> {
    BatchQueueItem findFirstByVisibleAtLessThanEqualOrderByEnqueuedAtAscIdAsc(long now);
}
