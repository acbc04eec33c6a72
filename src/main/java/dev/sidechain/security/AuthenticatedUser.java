package dev.sidechain.security;

/**
 * Principal placed in the security context by {@link JwtAuthenticationFilter}.
 */
public record AuthenticatedUser(String userId, String username, String role) {

    public boolean isService() {
        return JwtTokenProvider.ROLE_SERVICE.equals(role);
    }
}
