package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "smart_groups")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class SmartGroup {
    @Id
    private String id;
    @Column(nullable = false)
    private String name;
    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;
    @Column(name = "created_by_upn", nullable = false)
    private String createdByUpn;
    @Column(name = "created_date", nullable = false)
    private Long createdDate;
    @Column(name = "last_resolved_date")
    private Long lastResolvedDate;
    @Column(name = "last_resolved_member_count")
    private Integer lastResolvedMemberCount;
}
