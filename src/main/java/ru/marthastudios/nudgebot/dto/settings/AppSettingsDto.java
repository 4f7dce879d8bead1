package ru.marthastudios.nudgebot.dto.settings;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
public class AppSettingsDto {
    private String followUpChatSystemPrompt;
    private String defaultFollowUpChatSystemPrompt;
    private Long lastModifiedDate;
    private String lastModifiedByUpn;
}
