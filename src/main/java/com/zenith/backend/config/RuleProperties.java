package com.zenith.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "zenith.rules")
@Data
@Validated
public class RuleProperties {

    /**
     * Stress levels strictly above this value trigger the impulse rule.
     */
    @Min(1)
    @Max(10)
    private int stressThreshold = 7;

    /**
     * Purchases strictly above this amount are impulse-checked.
     */
    @Positive
    private BigDecimal impulseAmount = new BigDecimal("50");
}
