package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.CachedUserConversation;

@Repository
public interface CachedUserConversationRepository extends JpaRepository<CachedUserConversation, String> {
}
