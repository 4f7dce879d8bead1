package ru.marthastudios.nudgebot.dto.botframework;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttachmentDto {
    public static final String ADAPTIVE_CARD_CONTENT_TYPE = "application/vnd.microsoft.card.adaptive";
    public static final String HERO_CARD_CONTENT_TYPE = "application/vnd.microsoft.card.hero";

    private String contentType;
    private Object content;

    public static AttachmentDto heroCard(String title, String text) {
        return AttachmentDto.builder()
                .contentType(HERO_CARD_CONTENT_TYPE)
                .content(HeroCardDto.builder()
                        .title(title)
                        .text(text)
                        .build())
                .build();
    }
}
