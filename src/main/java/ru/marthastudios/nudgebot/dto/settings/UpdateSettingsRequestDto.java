package ru.marthastudios.nudgebot.dto.settings;

import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class UpdateSettingsRequestDto {
    private String followUpChatSystemPrompt;
}
