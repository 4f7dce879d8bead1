package ru.marthastudios.nudgebot.dto.smartgroup;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class SmartGroupMemberDto {
    private String userPrincipalName;
    private String displayName;
    private String department;
    private String jobTitle;
    private Double confidenceScore;
}
