package ru.marthastudios.nudgebot.dto.stats;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class MessageStatusStatsDto {
    private int sentCount;
    private int failedCount;
    private int pendingCount;
    private int totalCount;
}
