package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "membership_status_events",
        indexes = {
            @Index(name = "idx_status_events_membership", columnList = "membership_id"),
            @Index(name = "idx_status_events_pool_created", columnList = "account_pool_id, created_at")
        })
public class MembershipStatusEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_pool_id", nullable = false)
    private Long accountPoolId;

    @Column(name = "membership_id", nullable = false)
    private Long membershipId;

    @Column(name = "social_account_id", nullable = false)
    private Long socialAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private StatusEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "old_status", length = 20)
    private MembershipStatus oldStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", length = 20)
    private MembershipStatus newStatus;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false, length = 20)
    private EventTrigger triggeredBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
