package com.zenith.backend.dto;

import com.zenith.backend.model.SurveyProfile;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingRequest {

    @NotNull
    private SurveyProfile survey;

    @PositiveOrZero
    private BigDecimal balance;

    @Min(1)
    @Max(10)
    private Integer stressLevel;
}
