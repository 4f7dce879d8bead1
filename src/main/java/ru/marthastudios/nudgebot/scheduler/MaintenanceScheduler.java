package ru.marthastudios.nudgebot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.bot.BotStateStore;
import ru.marthastudios.nudgebot.service.BotConversationCache;

@Component
@RequiredArgsConstructor
@Slf4j
public class MaintenanceScheduler {
    private final BotStateStore botStateStore;
    private final BotConversationCache botConversationCache;

    @Scheduled(cron = "${nudge.maintenance-cron:0 0 0 * * *}")
    public void handleMaintenance() {
        log.info("Starting handleMaintenance method");

        try {
            botStateStore.evictExpired();
            botConversationCache.reload();
        } catch (Exception e) {
            log.error("Maintenance run failed", e);
        }

        log.info("Maintenance finished, {} bot state entries in memory", botStateStore.size());
    }
}
