package ru.marthastudios.nudgebot.pojo;

import lombok.*;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class MessageSendResult {
    private boolean success;
    private String messageLogId;
    private String recipientUpn;
    private String errorMessage;
}
