package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.MessageBatch;

import java.util.List;

@Repository
public interface MessageBatchRepository extends JpaRepository<MessageBatch, String> {
    List<MessageBatch> findAllByOrderByCreatedDateDesc();
    List<MessageBatch> findAllByTemplateId(String templateId);
}
