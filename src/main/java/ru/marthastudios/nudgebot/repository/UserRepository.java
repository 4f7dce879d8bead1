package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.User;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    boolean existsByAzureAdId(String azureAdId);
    User findByAzureAdId(String azureAdId);
}
