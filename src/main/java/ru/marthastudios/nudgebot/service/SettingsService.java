package ru.marthastudios.nudgebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.marthastudios.nudgebot.entity.AppSettings;
import ru.marthastudios.nudgebot.repository.AppSettingsRepository;

@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {
    public static final String DEFAULT_FOLLOW_UP_CHAT_SYSTEM_PROMPT =
            "You are a helpful assistant for a Microsoft Teams bot called Office Nudge. \n"
            + "Users receive nudge messages (tips, reminders, notifications) and may reply with questions or feedback.\n"
            + "\n"
            + "Your role:\n"
            + "1. Answer questions about the nudge content helpfully\n"
            + "2. Provide additional information or clarification when asked\n"
            + "3. Be concise and professional\n"
            + "4. If the user seems done with the conversation, indicate that in your response\n"
            + "\n"
            + "Keep responses brief and suitable for a Teams chat. Use markdown formatting sparingly.";

    private final AppSettingsRepository appSettingsRepository;

    /**
     * Stored settings, or an unsaved default row when nothing has been saved yet.
     */
    public AppSettings getSettings() {
        return appSettingsRepository.findById(AppSettings.SINGLETON_ID)
                .orElseGet(() -> AppSettings.builder().id(AppSettings.SINGLETON_ID).build());
    }

    /**
     * A blank prompt clears the custom value so the default applies again.
     */
    @Transactional
    public AppSettings updateSettings(String followUpChatSystemPrompt, String modifiedByUpn) {
        AppSettings settings = getSettings();

        String prompt = followUpChatSystemPrompt == null || followUpChatSystemPrompt.isBlank()
                ? null
                : followUpChatSystemPrompt.trim();

        settings.setFollowUpChatSystemPrompt(prompt);
        settings.setLastModifiedDate(System.currentTimeMillis());
        settings.setLastModifiedByUpn(modifiedByUpn);

        log.info("Settings updated by {} (custom prompt: {})", modifiedByUpn, prompt != null);

        return appSettingsRepository.save(settings);
    }

    @Transactional
    public AppSettings resetToDefaults(String modifiedByUpn) {
        return updateSettings(null, modifiedByUpn);
    }

    public String getEffectiveFollowUpChatSystemPrompt() {
        String customPrompt = getSettings().getFollowUpChatSystemPrompt();

        return customPrompt != null && !customPrompt.isBlank() ? customPrompt : DEFAULT_FOLLOW_UP_CHAT_SYSTEM_PROMPT;
    }
}
