package com.clipflow.publisher.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Entity
@Table(name = "platform_credentials", indexes = {
    @Index(name = "idx_credentials_platform_active", columnList = "platform, active")
})
public class PlatformCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Platform platform;

    // Page id for Facebook, business account id for Instagram
    private String accountId;
    private String accountName;

    @Column(length = 1024, nullable = false)
    private String accessToken;

    // Null for tokens that never expire
    private LocalDateTime expiresAt;

    private boolean active = true;

    private LocalDateTime lastRefreshedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> scopes = new ArrayList<>();

    @Version
    private Long version;

    public PlatformCredential(Platform platform, String accountId, String accountName,
                              String accessToken, LocalDateTime expiresAt, LocalDateTime refreshedAt) {
        this.platform = platform;
        this.accountId = accountId;
        this.accountName = accountName;
        this.accessToken = accessToken;
        this.expiresAt = expiresAt;
        this.lastRefreshedAt = refreshedAt;
        this.active = true;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /** A new active record for the same account carrying a fresh token. */
    public PlatformCredential renew(String newToken, LocalDateTime newExpiresAt, LocalDateTime now) {
        PlatformCredential renewed = new PlatformCredential(platform, accountId, accountName, newToken, newExpiresAt, now);
        renewed.setScopes(scopes == null ? new ArrayList<>() : new ArrayList<>(scopes));
        return renewed;
    }
}
