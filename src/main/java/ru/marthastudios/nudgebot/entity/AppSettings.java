package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "app_settings")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class AppSettings {
    public static final String SINGLETON_ID = "settings";

    @Id
    private String id;
    @Column(name = "follow_up_chat_system_prompt", columnDefinition = "TEXT")
    private String followUpChatSystemPrompt;
    @Column(name = "last_modified_date")
    private Long lastModifiedDate;
    @Column(name = "last_modified_by_upn")
    private String lastModifiedByUpn;
}
