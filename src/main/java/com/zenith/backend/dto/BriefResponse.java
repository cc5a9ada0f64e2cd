package com.zenith.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BriefResponse {
    private String topic;
    private String content;
    private boolean cached;
    private boolean fallback;
    private Instant generatedAt;
}
