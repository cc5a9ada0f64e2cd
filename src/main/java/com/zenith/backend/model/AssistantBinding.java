package com.zenith.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "ai_assistants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantBinding {

    @Id
    @Column(length = 32)
    private String topic;

    @Column(name = "assistant_id", nullable = false, length = 128)
    private String assistantId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
