package ru.marthastudios.nudgebot.dto.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphConnectionTestDto {
    private boolean success;
    private String message;
    private Integer userCount;
    private String details;
    private Long timestamp;
}
