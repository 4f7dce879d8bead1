package ru.marthastudios.nudgebot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "smart_group_members")
@AllArgsConstructor
@NoArgsConstructor
@Setter
@Getter
@Builder
public class SmartGroupMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "smart_group_id", nullable = false)
    private String smartGroupId;
    @Column(name = "user_principal_name", nullable = false)
    private String userPrincipalName;
    @Column(name = "display_name")
    private String displayName;
    private String department;
    @Column(name = "job_title")
    private String jobTitle;
    @Column(name = "confidence_score")
    private Double confidenceScore;
}
