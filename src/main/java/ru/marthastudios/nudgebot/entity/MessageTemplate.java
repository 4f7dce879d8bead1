package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "message_templates")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class MessageTemplate {
    @Id
    private String id;
    @Column(name = "template_name", nullable = false)
    private String templateName;
    @Column(name = "json_payload", nullable = false, columnDefinition = "TEXT")
    private String jsonPayload;
    @Column(name = "created_by_upn", nullable = false)
    private String createdByUpn;
    @Column(name = "created_date", nullable = false)
    private Long createdDate;
}
