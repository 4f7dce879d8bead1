package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "message_batches")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class MessageBatch {
    @Id
    private String id;
    @Column(name = "batch_name", nullable = false)
    private String batchName;
    @Column(name = "template_id", nullable = false)
    private String templateId;
    @Column(name = "sender_upn", nullable = false)
    private String senderUpn;
    @Column(name = "created_date", nullable = false)
    private Long createdDate;
}
