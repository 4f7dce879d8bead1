package ru.marthastudios.nudgebot.dto.template;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class UpdateLogStatusRequestDto {
    private String status;
    private String lastError;
}
