package com.zenith.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StressUpdateRequest {

    @NotNull
    @Min(1)
    @Max(10)
    private Integer level;

    @Size(max = 500)
    private String note;
}
