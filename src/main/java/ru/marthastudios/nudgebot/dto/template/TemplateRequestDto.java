package ru.marthastudios.nudgebot.dto.template;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class TemplateRequestDto {
    private String templateName;
    private String jsonPayload;
}
