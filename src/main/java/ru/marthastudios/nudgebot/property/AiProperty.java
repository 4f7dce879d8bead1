package ru.marthastudios.nudgebot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Azure AI Foundry deployment used for smart groups and follow-up chat ("Copilot Connected" mode).
 */
@Component
@Getter
@Setter
public class AiProperty {
    private static final float DEFAULT_TEMPERATURE = 0.7f;

    @Value("${ai.endpoint:}")
    private String endpoint;

    @Value("${ai.deployment-name:}")
    private String deploymentName;

    @Value("${ai.api-key:}")
    private String apiKey;

    @Value("${ai.api-version:2024-06-01}")
    private String apiVersion;

    @Value("${ai.max-tokens:2000}")
    private int maxTokens;

    @Value("${ai.temperature:0.7}")
    private String temperature;

    public boolean isConfigured() {
        return endpoint != null && !endpoint.isBlank()
                && deploymentName != null && !deploymentName.isBlank()
                && apiKey != null && !apiKey.isBlank();
    }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public float getParsedTemperature() {
        if (temperature == null) {
            return DEFAULT_TEMPERATURE;
        }

        try {
            float value = Float.parseFloat(temperature.trim());

            return Math.max(0f, Math.min(1f, value));
        } catch (NumberFormatException e) {
            return DEFAULT_TEMPERATURE;
        }
    }
}
