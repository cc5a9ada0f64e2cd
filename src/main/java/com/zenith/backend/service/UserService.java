package com.zenith.backend.service;

import com.zenith.backend.dto.BalanceResponse;
import com.zenith.backend.dto.OnboardingRequest;
import com.zenith.backend.dto.StressLogDTO;
import com.zenith.backend.dto.UserProfileDTO;
import com.zenith.backend.exception.BadRequestException;
import com.zenith.backend.exception.NotFoundException;
import com.zenith.backend.model.StressLog;
import com.zenith.backend.model.SurveyProfile;
import com.zenith.backend.model.User;
import com.zenith.backend.repository.StressLogRepository;
import com.zenith.backend.repository.UserRepository;
import com.zenith.backend.service.ai.UserContext;
import com.zenith.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final StressLogRepository stressLogRepository;

    public User getUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    @Transactional(readOnly = true)
    public UserProfileDTO profile(Long userId) {
        return UserProfileDTO.from(getUser(userId));
    }

    @Transactional(readOnly = true)
    public BalanceResponse balance(Long userId) {
        User user = getUser(userId);
        return new BalanceResponse(user.getBalance(), user.getStressLevel());
    }

    /**
     * Stores the survey and stress level. The starting balance is only accepted on the first
     * onboarding; afterwards balance moves through purchases and income only.
     */
    @Transactional
    public UserProfileDTO onboard(Long userId, OnboardingRequest request) {
        if (request.getBalance() != null
                && userRepository.setStartingBalance(userId, MoneyUtils.scale(request.getBalance())) > 0) {
            log.info("User {} starting balance set", userId);
        }
        User user = getUser(userId);
        user.setSurvey(request.getSurvey());
        if (request.getStressLevel() != null) {
            applyStress(user, request.getStressLevel(), "Onboarding");
        }
        user.setOnboarded(true);
        log.info("User {} onboarded", userId);
        return UserProfileDTO.from(userRepository.save(user));
    }

    @Transactional(readOnly = true)
    public SurveyProfile survey(Long userId) {
        SurveyProfile survey = getUser(userId).getSurvey();
        return survey != null ? survey : new SurveyProfile();
    }

    @Transactional
    public SurveyProfile updateSurvey(Long userId, SurveyProfile survey) {
        if (survey == null) {
            throw new BadRequestException("Survey body is required");
        }
        User user = getUser(userId);
        user.setSurvey(survey);
        userRepository.save(user);
        return survey;
    }

    @Transactional
    public StressLogDTO updateStress(Long userId, Integer level, String note) {
        User user = getUser(userId);
        StressLog entry = applyStress(user, level, note);
        userRepository.save(user);
        return StressLogDTO.from(entry);
    }

    @Transactional(readOnly = true)
    public List<StressLogDTO> stressHistory(Long userId) {
        return stressLogRepository.findByUserIdOrderByLogDateDescIdDesc(userId).stream()
                .map(StressLogDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public UserContext userContext(Long userId) {
        User user = getUser(userId);
        return new UserContext(user.getSurvey(), user.getBalance(), user.getStressLevel());
    }

    private StressLog applyStress(User user, Integer level, String note) {
        if (level == null || level < 1 || level > 10) {
            throw new BadRequestException("Stress level must be between 1 and 10");
        }
        user.setStressLevel(level);
        return stressLogRepository.save(StressLog.builder()
                .userId(user.getId())
                .level(level)
                .note(note)
                .build());
    }
}
