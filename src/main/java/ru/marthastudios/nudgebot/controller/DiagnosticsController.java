package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.marthastudios.nudgebot.api.GraphApi;
import ru.marthastudios.nudgebot.dto.stats.GraphConnectionTestDto;

@RestController
@RequestMapping("/api/Diagnostics")
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsController {
    private final GraphApi graphApi;

    /**
     * Always answers 200; the outcome is in {@code success}.
     */
    @GetMapping("/TestGraphConnection")
    public GraphConnectionTestDto testGraphConnection() {
        log.info("Testing Graph API connection");

        try {
            int userCount = graphApi.getTotalUserCount();

            return GraphConnectionTestDto.builder()
                    .success(true)
                    .message("Successfully connected to Graph API")
                    .userCount(userCount)
                    .timestamp(System.currentTimeMillis())
                    .build();
        } catch (Exception e) {
            log.error("Error testing Graph connection", e);

            return GraphConnectionTestDto.builder()
                    .success(false)
                    .message(e.getMessage())
                    .details(e.getCause() != null ? e.getCause().getMessage() : null)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
