package ru.marthastudios.nudgebot.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.context.annotation.Import;
import ru.marthastudios.nudgebot.configuration.SecurityConfiguration;
import ru.marthastudios.nudgebot.dto.stats.MessageStatusStatsDto;
import ru.marthastudios.nudgebot.dto.stats.UserCoverageStatsDto;
import ru.marthastudios.nudgebot.service.StatisticsService;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StatisticsController.class)
@Import(SecurityConfiguration.class)
class StatisticsControllerTest {
    @Autowired
    private MockMvc mockMvc;
    @MockBean
    private StatisticsService statisticsService;

    @Test
    void messageStatusStats() throws Exception {
        when(statisticsService.getMessageStatusStats()).thenReturn(MessageStatusStatsDto.builder()
                .sentCount(3)
                .failedCount(1)
                .pendingCount(2)
                .totalCount(6)
                .build());

        mockMvc.perform(get("/api/Statistics/GetMessageStatusStats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sentCount").value(3))
                .andExpect(jsonPath("$.totalCount").value(6));
    }

    @Test
    void userCoverageStats() throws Exception {
        when(statisticsService.getUserCoverageStats()).thenReturn(UserCoverageStatsDto.builder()
                .usersMessaged(2)
                .totalUsersInTenant(4)
                .usersNotMessaged(2)
                .coveragePercentage(50.0)
                .build());

        mockMvc.perform(get("/api/Statistics/GetUserCoverageStats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coveragePercentage").value(50.0));
    }
}
