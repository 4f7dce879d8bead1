package ru.marthastudios.nudgebot.pojo;

import lombok.*;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class AiFollowUpResponse {
    private String response;
    private boolean shouldEndConversation;
}
