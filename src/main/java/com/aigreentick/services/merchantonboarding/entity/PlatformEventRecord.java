package com.aigreentick.services.merchantonboarding.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Ledger entry for a standard, kyc or transfer notification.
 * At most one row per pspReference.
 */
@Entity
@Table(
        name = "platform_events",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_platform_events_psp_reference", columnNames = "psp_reference")
        },
        indexes = {
                @Index(name = "idx_platform_events_entity", columnList = "entity_type, entity_id"),
                @Index(name = "idx_platform_events_merchant_ref", columnList = "merchant_reference"),
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlatformEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 100)
    private String eventId;

    @Column(name = "event_code", nullable = false, length = 150)
    private String eventCode;

    @Column(name = "category", nullable = false, length = 30)
    private String category;

    @Column(name = "entity_type", nullable = false, length = 30)
    private String entityType;

    @Column(name = "entity_id", length = 150)
    private String entityId;

    @Column(name = "blob_key", length = 300)
    private String blobKey;

    @Column(name = "psp_reference", nullable = false, length = 150)
    private String pspReference;

    @Column(name = "merchant_account_code", length = 150)
    private String merchantAccountCode;

    @Column(name = "merchant_reference", length = 150)
    private String merchantReference;

    @Column(name = "success")
    private Boolean success;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "status", nullable = false, length = 30)
    private String status;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;
}
