package ru.marthastudios.nudgebot.dto.smartgroup;

import lombok.*;

import java.util.List;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class SmartGroupPreviewResponseDto {
    private List<SmartGroupMemberDto> members;
    private int count;
}
