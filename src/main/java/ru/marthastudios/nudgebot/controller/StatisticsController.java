package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.marthastudios.nudgebot.dto.stats.MessageStatusStatsDto;
import ru.marthastudios.nudgebot.dto.stats.UserCoverageStatsDto;
import ru.marthastudios.nudgebot.service.StatisticsService;

@RestController
@RequestMapping("/api/Statistics")
@RequiredArgsConstructor
public class StatisticsController {
    private final StatisticsService statisticsService;

    @GetMapping("/GetMessageStatusStats")
    public MessageStatusStatsDto getMessageStatusStats() {
        return statisticsService.getMessageStatusStats();
    }

    @GetMapping("/GetUserCoverageStats")
    public UserCoverageStatsDto getUserCoverageStats() {
        return statisticsService.getUserCoverageStats();
    }
}
