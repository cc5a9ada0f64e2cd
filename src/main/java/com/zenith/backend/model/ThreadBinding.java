package com.zenith.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "user_threads", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"user_id", "topic"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadBinding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 32)
    private String topic;

    @Column(name = "thread_id", nullable = false, length = 128)
    private String threadId;

    @Column(nullable = false)
    private boolean initialized;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
