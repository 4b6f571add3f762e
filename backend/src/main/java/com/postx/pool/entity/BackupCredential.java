package com.postx.pool.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Encrypted copy of one credential of a social account. At most one backup per account and type is
 * primary; restore reads the newest primary one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "backup_credentials",
        indexes = {
            @Index(
                    name = "idx_backup_credentials_account_type",
                    columnList = "social_account_id, credential_type, is_primary")
        })
public class BackupCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "social_account_id", nullable = false)
    private Long socialAccountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "credential_type", nullable = false, length = 20)
    private CredentialType credentialType;

    @ToString.Exclude
    @Column(name = "encrypted_value", nullable = false, columnDefinition = "TEXT")
    private String encryptedValue;

    private String description;

    @Column(name = "is_primary", nullable = false)
    @Builder.Default
    private boolean primary = false;

    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Column(name = "last_verified_at")
    private LocalDateTime lastVerifiedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isValidAt(LocalDateTime now) {
        return validUntil == null || validUntil.isAfter(now);
    }
}
