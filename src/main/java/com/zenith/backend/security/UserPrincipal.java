package com.zenith.backend.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.security.Principal;

/**
 * Authenticated Zenith user, resolved from the current session token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrincipal implements Principal {
    private Long userId;
    private String username;

    @Override
    public String getName() {
        return username;
    }
}
