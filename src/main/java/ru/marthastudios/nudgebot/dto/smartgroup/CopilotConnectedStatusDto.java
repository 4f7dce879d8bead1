package ru.marthastudios.nudgebot.dto.smartgroup;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class CopilotConnectedStatusDto {
    @JsonProperty("isEnabled")
    private boolean enabled;
    @JsonProperty("hasAIFoundryConfig")
    private boolean hasAiFoundryConfig;
}
