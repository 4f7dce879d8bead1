package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;

import java.util.Collection;
import java.util.List;

@Repository
public interface MessageLogRepository extends JpaRepository<MessageLog, String> {
    List<MessageLog> findAllByOrderBySentDateDesc();
    List<MessageLog> findAllByMessageBatchIdOrderBySentDateDesc(String messageBatchId);
    List<MessageLog> findAllByMessageBatchIdInOrderBySentDateDesc(Collection<String> messageBatchIds);
    List<MessageLog> findAllByRecipientUpnIgnoreCaseAndStatusOrderBySentDateDesc(String recipientUpn, MessageLogStatus status);
    @Modifying
    @Query("DELETE FROM MessageLog l WHERE l.messageBatchId = :batchId")
    void deleteAllByBatchId(@Param("batchId") String batchId);
}
