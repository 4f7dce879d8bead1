package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.marthastudios.nudgebot.api.GraphApi;
import ru.marthastudios.nudgebot.dto.stats.MessageStatusStatsDto;
import ru.marthastudios.nudgebot.dto.stats.UserCoverageStatsDto;
import ru.marthastudios.nudgebot.entity.MessageLog;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticsService {
    private final MessageTemplateService messageTemplateService;
    private final GraphApi graphApi;

    public MessageStatusStatsDto getMessageStatusStats() {
        List<MessageLog> logs = messageTemplateService.getAllMessageLogs();

        int sentCount = 0;
        int failedCount = 0;
        int pendingCount = 0;

        for (MessageLog messageLog : logs) {
            switch (messageLog.getStatus()) {
                case SENT, SUCCESS -> sentCount++;
                case FAILED -> failedCount++;
                case PENDING -> pendingCount++;
            }
        }

        log.info("Message stats - Sent: {}, Failed: {}, Pending: {}", sentCount, failedCount, pendingCount);

        return MessageStatusStatsDto.builder()
                .sentCount(sentCount)
                .failedCount(failedCount)
                .pendingCount(pendingCount)
                .totalCount(logs.size())
                .build();
    }

    public UserCoverageStatsDto getUserCoverageStats() {
        List<MessageLog> logs = messageTemplateService.getAllMessageLogs();

        int usersMessaged = (int) logs.stream()
                .map(MessageLog::getRecipientUpn)
                .filter(upn -> upn != null && !upn.isBlank())
                .distinct()
                .count();

        int totalUsersInTenant = graphApi.getTotalUserCount();

        log.info("User coverage - Messaged: {}, Total in tenant: {}", usersMessaged, totalUsersInTenant);

        return UserCoverageStatsDto.builder()
                .usersMessaged(usersMessaged)
                .totalUsersInTenant(totalUsersInTenant)
                .usersNotMessaged(totalUsersInTenant - usersMessaged)
                .coveragePercentage(calculateCoverage(usersMessaged, totalUsersInTenant))
                .build();
    }

    static double calculateCoverage(int usersMessaged, int totalUsersInTenant) {
        if (totalUsersInTenant <= 0) {
            return 0;
        }

        return BigDecimal.valueOf((double) usersMessaged / totalUsersInTenant * 100)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }
}
