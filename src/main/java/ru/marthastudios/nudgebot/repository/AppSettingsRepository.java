package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.AppSettings;

@Repository
public interface AppSettingsRepository extends JpaRepository<AppSettings, String> {
}
