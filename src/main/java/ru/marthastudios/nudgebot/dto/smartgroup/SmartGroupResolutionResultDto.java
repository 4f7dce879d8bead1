package ru.marthastudios.nudgebot.dto.smartgroup;

import lombok.*;

import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class SmartGroupResolutionResultDto {
    private String smartGroupId;
    private String smartGroupName;
    private List<SmartGroupMemberDto> members;
    private Long resolvedAt;
    private boolean fromCache;
}
