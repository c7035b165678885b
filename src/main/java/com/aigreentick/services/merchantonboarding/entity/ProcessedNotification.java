package com.aigreentick.services.merchantonboarding.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Ingestion dedup ledger. A row exists for every notification item that has been
 * published once; inserting the same dedup key twice fails on the unique constraint.
 */
@Entity
@Table(
        name = "processed_notifications",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_processed_notifications_key", columnNames = "dedup_key")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessedNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dedup_key", nullable = false, length = 400)
    private String dedupKey;

    @Column(name = "webhook_id", nullable = false, length = 100)
    private String webhookId;

    @Column(name = "event_code", length = 150)
    private String eventCode;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;
}
