package com.adflux.services.adplatforms.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Persisted auth state of one platform. One row per platform.
 *
 * access_token is stored encrypted ("ENC:" prefix, AES-256-GCM),
 * see TokenEncryptionService.
 */
@Entity
@Table(name = "platform_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlatformToken {

    /** Platform tag, e.g. "meta" */
    @Id
    @Column(name = "platform", length = 20)
    private String platform;

    @Column(name = "access_token", columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "authenticated", nullable = false)
    private boolean authenticated;

    /** null = token never expires (X) */
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_refreshed")
    private Instant lastRefreshed;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
