package com.zenith.backend.service;

import com.zenith.backend.dto.AuthResponse;
import com.zenith.backend.dto.LoginRequest;
import com.zenith.backend.dto.RegisterRequest;
import com.zenith.backend.dto.UserProfileDTO;
import com.zenith.backend.exception.ConflictException;
import com.zenith.backend.exception.UnauthorizedException;
import com.zenith.backend.model.User;
import com.zenith.backend.repository.UserRepository;
import com.zenith.backend.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String BAD_CREDENTIALS = "Invalid username or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional
    public UserProfileDTO register(RegisterRequest request) {
        String username = request.getUsername().trim();
        if (userRepository.existsByUsername(username)) {
            throw new ConflictException("Username already taken");
        }
        try {
            User user = userRepository.saveAndFlush(User.builder()
                    .username(username)
                    .passwordHash(passwordEncoder.encode(request.getPassword()))
                    .build());
            log.info("Registered user {}", user.getId());
            return UserProfileDTO.from(user);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Username already taken", e);
        }
    }

    /**
     * Issues a fresh token and makes it the user's only valid session.
     */
    @Transactional
    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByUsername(request.getUsername().trim())
                .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Login failed for username '{}'", request.getUsername());
                    return new UnauthorizedException(BAD_CREDENTIALS);
                });
        String token = jwtTokenProvider.generateToken(user.getUsername(), user.getId());
        user.setSessionToken(token);
        user.setLastLogin(LocalDateTime.now());
        userRepository.save(user);
        log.info("User {} logged in", user.getId());
        return new AuthResponse(token, UserProfileDTO.from(user));
    }

    @Transactional
    public void logout(Long userId) {
        userRepository.findById(userId).ifPresent(user -> {
            user.setSessionToken(null);
            userRepository.save(user);
            log.info("User {} logged out", userId);
        });
    }
}
