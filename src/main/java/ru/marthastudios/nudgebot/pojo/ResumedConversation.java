package ru.marthastudios.nudgebot.pojo;

import lombok.*;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;

/**
 * What to send when a conversation is resumed. {@code data} is null when the attachment is a fallback.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class ResumedConversation<T> {
    private T data;
    private AttachmentDto attachment;
}
