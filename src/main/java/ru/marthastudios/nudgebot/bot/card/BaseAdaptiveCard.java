package ru.marthastudios.nudgebot.bot.card;

import org.springframework.core.io.ClassPathResource;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;
import ru.marthastudios.nudgebot.util.AdaptiveCardUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public abstract class BaseAdaptiveCard {
    public abstract String getCardContent();

    protected String readResource(String resourcePath) {
        try (InputStream inputStream = new ClassPathResource(resourcePath).getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Can't read card resource " + resourcePath, e);
        }
    }

    public AttachmentDto getCardAttachment() {
        return AdaptiveCardUtils.toAttachment(getCardContent());
    }
}
