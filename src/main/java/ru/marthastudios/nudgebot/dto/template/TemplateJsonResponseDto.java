package ru.marthastudios.nudgebot.dto.template;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class TemplateJsonResponseDto {
    private String json;
}
