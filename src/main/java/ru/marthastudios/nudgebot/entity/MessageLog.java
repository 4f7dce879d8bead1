package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;
import ru.marthastudios.nudgebot.enums.MessageLogStatus;

@Entity
@Table(name = "message_logs")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class MessageLog {
    @Id
    private String id;
    @Column(name = "message_batch_id", nullable = false)
    private String messageBatchId;
    @Column(name = "sent_date", nullable = false)
    private Long sentDate;
    @Column(name = "recipient_upn")
    private String recipientUpn;
    @Column(name = "status", nullable = false)
    @Enumerated(value = EnumType.STRING)
    private MessageLogStatus status;
    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;
}
