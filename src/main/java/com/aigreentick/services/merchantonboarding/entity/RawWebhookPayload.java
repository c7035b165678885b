package com.aigreentick.services.merchantonboarding.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "raw_webhook_payloads",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_raw_webhook_payloads_key", columnNames = "blob_key")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawWebhookPayload {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** platform-webhooks/{yyyy}/{MM}/{webhookId}.json */
    @Column(name = "blob_key", nullable = false, length = 300)
    private String blobKey;

    @Column(name = "content_type", nullable = false, length = 100)
    @Builder.Default
    private String contentType = "application/json";

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "stored_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime storedAt;
}
