package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Append-only audit row for one publish attempt. Not read by the dispatch path. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "dispatch_outcome_log",
        indexes = {
            @Index(name = "idx_dispatch_outcome_pool_created", columnList = "account_pool_id, created_at"),
            @Index(name = "idx_dispatch_outcome_membership", columnList = "membership_id"),
            @Index(name = "idx_dispatch_outcome_dispatch", columnList = "dispatch_id")
        })
public class DispatchOutcomeRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dispatch_id", nullable = false, length = 36)
    private String dispatchId;

    @Column(name = "account_pool_id", nullable = false)
    private Long accountPoolId;

    @Column(name = "membership_id", nullable = false)
    private Long membershipId;

    @Column(name = "social_account_id", nullable = false)
    private Long socialAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(nullable = false)
    private boolean success;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 30)
    private PublishErrorKind errorKind;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "post_id")
    private String postId;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
