package ru.marthastudios.nudgebot.dto.smartgroup;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class PreviewSmartGroupRequestDto {
    private String description;
    @Builder.Default
    private int maxUsers = 100;
}
