package ru.marthastudios.nudgebot.dto.stats;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class UserCoverageStatsDto {
    private int usersMessaged;
    private int totalUsersInTenant;
    private int usersNotMessaged;
    private double coveragePercentage;
}
