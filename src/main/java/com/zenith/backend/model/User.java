package com.zenith.backend.model;

import com.zenith.backend.util.MoneyUtils;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Account holder. The balance column is excluded from entity updates: it only moves through the
 * conditional statements in {@link com.zenith.backend.repository.UserRepository}, so saving a stale
 * copy of this entity never rewrites it.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    @Builder.Default
    private BigDecimal balance = MoneyUtils.ZERO;

    @Column(name = "stress_level", nullable = false)
    @Builder.Default
    private Integer stressLevel = 5;

    @Column(name = "survey_data", columnDefinition = "TEXT")
    @Convert(converter = SurveyProfileConverter.class)
    private SurveyProfile survey;

    @Column(nullable = false)
    @Builder.Default
    private Boolean onboarded = false;

    @Column(name = "session_token", length = 512, unique = true)
    private String sessionToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
