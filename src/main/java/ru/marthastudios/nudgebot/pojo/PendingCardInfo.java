package ru.marthastudios.nudgebot.pojo;

import lombok.*;
import ru.marthastudios.nudgebot.dto.botframework.AttachmentDto;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class PendingCardInfo {
    private String messageLogId;
    private String batchId;
    private String templateId;
    private String templateName;
    private String cardJson;
    private AttachmentDto cardAttachment;
    private Long sentDate;
    private String recipientUpn;
}
