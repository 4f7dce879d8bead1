package ru.marthastudios.nudgebot.pojo;

import lombok.*;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class CachedUserAndConversationData {
    private String azureAdId;
    private String userPrincipalName;
    private String serviceUrl;
    private String conversationId;
}
