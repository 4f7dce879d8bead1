package ru.marthastudios.nudgebot.dto.smartgroup;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class SmartGroupRequestDto {
    private String name;
    private String description;
}
