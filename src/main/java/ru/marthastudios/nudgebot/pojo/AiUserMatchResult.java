package ru.marthastudios.nudgebot.pojo;

import lombok.*;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class AiUserMatchResult {
    private String userPrincipalName;
    private double confidenceScore;
    private String reason;
}
