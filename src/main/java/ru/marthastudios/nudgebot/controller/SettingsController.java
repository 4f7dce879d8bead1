package ru.marthastudios.nudgebot.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import ru.marthastudios.nudgebot.dto.settings.AppSettingsDto;
import ru.marthastudios.nudgebot.dto.settings.UpdateSettingsRequestDto;
import ru.marthastudios.nudgebot.entity.AppSettings;
import ru.marthastudios.nudgebot.service.SettingsService;
import ru.marthastudios.nudgebot.util.PrincipalUtils;

import java.security.Principal;

@RestController
@RequestMapping("/api/Settings")
@RequiredArgsConstructor
@Slf4j
public class SettingsController {
    private final SettingsService settingsService;

    @GetMapping("/Get")
    public AppSettingsDto get() {
        return toDto(settingsService.getSettings());
    }

    @PutMapping("/Update")
    public AppSettingsDto update(@RequestBody UpdateSettingsRequestDto request, Principal principal) {
        String upn = PrincipalUtils.getUpn(principal);

        log.info("Updating settings by {}", upn);

        return toDto(settingsService.updateSettings(request.getFollowUpChatSystemPrompt(), upn));
    }

    @PostMapping("/ResetToDefaults")
    public AppSettingsDto resetToDefaults(Principal principal) {
        String upn = PrincipalUtils.getUpn(principal);

        log.info("Resetting settings to defaults by {}", upn);

        return toDto(settingsService.resetToDefaults(upn));
    }

    private static AppSettingsDto toDto(AppSettings settings) {
        return AppSettingsDto.builder()
                .followUpChatSystemPrompt(settings.getFollowUpChatSystemPrompt())
                .defaultFollowUpChatSystemPrompt(SettingsService.DEFAULT_FOLLOW_UP_CHAT_SYSTEM_PROMPT)
                .lastModifiedDate(settings.getLastModifiedDate())
                .lastModifiedByUpn(settings.getLastModifiedByUpn())
                .build();
    }
}
