package com.zenith.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "stress_logs", indexes = {
        @Index(name = "idx_stress_logs_user_date", columnList = "user_id, log_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "stress_level", nullable = false)
    private Integer level;

    @Column(length = 500)
    private String note;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (logDate == null) {
            logDate = createdAt.toLocalDate();
        }
    }
}
