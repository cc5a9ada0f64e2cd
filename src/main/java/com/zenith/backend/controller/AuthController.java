package com.zenith.backend.controller;

import com.zenith.backend.config.OpenApiConfig;
import com.zenith.backend.dto.AuthResponse;
import com.zenith.backend.dto.LoginRequest;
import com.zenith.backend.dto.MessageResponse;
import com.zenith.backend.dto.RegisterRequest;
import com.zenith.backend.dto.UserProfileDTO;
import com.zenith.backend.security.UserPrincipal;
import com.zenith.backend.service.AuthService;
import com.zenith.backend.service.UserService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_AUTH)
public class AuthController {

    private final AuthService authService;
    private final UserService userService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserProfileDTO register(@Valid @RequestBody RegisterRequest request) {
        return authService.register(request);
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/logout")
    public MessageResponse logout(@AuthenticationPrincipal UserPrincipal principal) {
        authService.logout(principal.getUserId());
        return new MessageResponse("Logout successful");
    }

    @GetMapping("/me")
    public UserProfileDTO me(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.profile(principal.getUserId());
    }
}
