package ru.marthastudios.nudgebot.dto.botframework;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HeroCardDto {
    private String title;
    private String subtitle;
    private String text;
}
