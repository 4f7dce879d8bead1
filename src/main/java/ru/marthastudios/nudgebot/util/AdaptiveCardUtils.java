package ru.marthastudios.nudgebot.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;

@Slf4j
public class AdaptiveCardUtils {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Wraps card JSON as an Adaptive Card attachment. JSON that can't be parsed gives an empty card.
     */
    public static AttachmentDto toAttachment(String cardJson) {
        return AttachmentDto.builder()
                .contentType(AttachmentDto.ADAPTIVE_CARD_CONTENT_TYPE)
                .content(parseCard(cardJson))
                .build();
    }

    static JsonNode parseCard(String cardJson) {
        if (cardJson == null || cardJson.isBlank()) {
            return OBJECT_MAPPER.createObjectNode();
        }

        try {
            JsonNode node = OBJECT_MAPPER.readTree(cardJson);

            return node != null && !node.isMissingNode() ? node : OBJECT_MAPPER.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Card JSON is not valid, sending an empty card: {}", e.getOriginalMessage());

            return OBJECT_MAPPER.createObjectNode();
        }
    }
}
