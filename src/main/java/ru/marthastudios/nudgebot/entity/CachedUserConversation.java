package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Stored conversation reference for a user the bot has talked to, keyed by Azure AD object id.
 */
@Entity
@Table(name = "conversation_cache")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class CachedUserConversation {
    @Id
    @Column(name = "azure_ad_id")
    private String azureAdId;
    @Column(name = "user_principal_name")
    private String userPrincipalName;
    @Column(name = "service_url", nullable = false)
    private String serviceUrl;
    @Column(name = "conversation_id", nullable = false)
    private String conversationId;
    @Column(nullable = false)
    private Long timestamp;
}
