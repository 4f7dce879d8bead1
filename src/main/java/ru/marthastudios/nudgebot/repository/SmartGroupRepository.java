package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.SmartGroup;

import java.util.List;

@Repository
public interface SmartGroupRepository extends JpaRepository<SmartGroup, String> {
    List<SmartGroup> findAllByOrderByCreatedDateDesc();
}
