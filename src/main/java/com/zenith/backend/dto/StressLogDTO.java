package com.zenith.backend.dto;

import com.zenith.backend.model.StressLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressLogDTO {
    private Long id;
    private Integer level;
    private String note;
    private LocalDate logDate;

    public static StressLogDTO from(StressLog log) {
        return StressLogDTO.builder()
                .id(log.getId())
                .level(log.getLevel())
                .note(log.getNote())
                .logDate(log.getLogDate())
                .build();
    }
}
