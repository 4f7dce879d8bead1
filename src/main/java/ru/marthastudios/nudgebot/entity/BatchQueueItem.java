package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One pending send. Items are invisible to other pollers until {@code visibleAt} once dequeued.
 */
@Entity
@Table(name = "batch_queue")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class BatchQueueItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "batch_id", nullable = false)
    private String batchId;
    @Column(name = "message_log_id", nullable = false)
    private String messageLogId;
    @Column(name = "recipient_upn", nullable = false)
    private String recipientUpn;
    @Column(name = "template_id", nullable = false)
    private String templateId;
    @Column(name = "enqueued_at", nullable = false)
    private Long enqueuedAt;
    @Column(name = "visible_at", nullable = false)
    private Long visibleAt;
    @Column(name = "dequeue_count", nullable = false)
    private Integer dequeueCount;
}
