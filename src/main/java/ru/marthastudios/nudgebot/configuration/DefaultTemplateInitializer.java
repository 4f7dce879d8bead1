package ru.marthastudios.nudgebot.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import ru.marthastudios.nudgebot.service.MessageTemplateService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seeds the default nudge templates when the template table is empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultTemplateInitializer {
    static final String SYSTEM_CREATOR = "system@initialization";

    static final Map<String, String> DEFAULT_TEMPLATES = new LinkedHashMap<>();

    static {
        DEFAULT_TEMPLATES.put("Copilot Chat - Tips (Beginner)", "templates/copilot-chat-tips.json");
        DEFAULT_TEMPLATES.put("Copilot Chat - Tips (Advanced)", "templates/copilot-chat-tips-advanced.json");
        DEFAULT_TEMPLATES.put("Microsoft 365 Copilot - Tips (Beginner)", "templates/m365-copilot-tips.json");
        DEFAULT_TEMPLATES.put("Microsoft 365 Copilot - Tips (Advanced)", "templates/m365-copilot-tips-advanced.json");
    }

    private final MessageTemplateService messageTemplateService;

    @EventListener({ApplicationReadyEvent.class})
    public void init() {
        log.info("Checking for default nudge templates...");

        try {
            long existingCount = messageTemplateService.getTemplateCount();

            if (existingCount > 0) {
                log.info("Found {} existing template(s). Skipping default template creation.", existingCount);
                return;
            }

            log.info("No templates found. Creating default nudge templates...");

            for (Map.Entry<String, String> template : DEFAULT_TEMPLATES.entrySet()) {
                messageTemplateService.createTemplate(template.getKey(), readTemplate(template.getValue()), SYSTEM_CREATOR);

                log.info("Created default template: {}", template.getKey());
            }

            log.info("Default templates created successfully.");
        } catch (Exception e) {
            log.error("Error initializing default templates. The application will continue but no default templates were created.", e);
        }
    }

    private static String readTemplate(String resourcePath) throws IOException {
        try (InputStream inputStream = new ClassPathResource(resourcePath).getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
