package com.zenith.backend.dto;

import com.zenith.backend.model.SurveyProfile;
import com.zenith.backend.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileDTO {
    private Long id;
    private String username;
    private BigDecimal balance;
    private Integer stressLevel;
    private boolean onboarded;
    private SurveyProfile survey;

    public static UserProfileDTO from(User user) {
        return UserProfileDTO.builder()
                .id(user.getId())
                .username(user.getUsername())
                .balance(user.getBalance())
                .stressLevel(user.getStressLevel())
                .onboarded(Boolean.TRUE.equals(user.getOnboarded()))
                .survey(user.getSurvey())
                .build();
    }
}
