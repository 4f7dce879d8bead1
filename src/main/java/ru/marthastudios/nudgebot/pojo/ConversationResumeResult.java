package ru.marthastudios.nudgebot.pojo;

import lombok.*;
import ru.marthastudios.nudgebot.enums.ConversationResumeStatus;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class ConversationResumeResult {
    private ConversationResumeStatus status;
    private String message;
    private Exception exception;

    public static ConversationResumeResult messageSent(String upn) {
        return ConversationResumeResult.builder()
                .status(ConversationResumeStatus.MESSAGE_SENT)
                .message("Message sent successfully to " + upn)
                .build();
    }

    public static ConversationResumeResult appInstalled(String upn) {
        return ConversationResumeResult.builder()
                .status(ConversationResumeStatus.APP_INSTALLED_PENDING)
                .message("Bot app installed for " + upn + ". Message will be sent when user opens the app.")
                .build();
    }

    public static ConversationResumeResult failed(String message) {
        return failed(message, null);
    }

    public static ConversationResumeResult failed(String message, Exception exception) {
        return ConversationResumeResult.builder()
                .status(ConversationResumeStatus.FAILED)
                .message(message)
                .exception(exception)
                .build();
    }
}
