package dev.sidechain.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies the HS512 access tokens issued by the Sidechain auth service.
 * Subject is the user id; {@code username} and {@code role} are custom claims.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String ISSUER = "sidechain";
    public static final String AUDIENCE = "sidechain-api";
    public static final String ROLE_USER = "USER";
    public static final String ROLE_SERVICE = "SERVICE";
    public static final String ROLE_ADMIN = "ADMIN";

    /** 64 bytes for HS512. */
    private static final int MIN_SECRET_LENGTH = 64;

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration:86400000}")
    private long expiration;

    private SecretKey key;
    private JwtParser jwtParser;

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "jwt.secret must be at least %d characters for HS512, got %d",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized (HS512, issuer={})", ISSUER);
    }

    /**
     * Issues a token. Production tokens come from the auth service; this serves service
     * accounts, local development and tests.
     */
    public String generateToken(String userId, String username, String role) {
        Instant now = Instant.now();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId)
                .claim("username", username)
                .claim("role", role)
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    /**
     * Outcome of verifying a token; {@code expired} separates normal expiry from a bad token.
     */
    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }

        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }

        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            return TokenValidationResult.success(jwtParser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            log.debug("JWT expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (MalformedJwtException e) {
            log.warn("Malformed JWT: {}", e.getMessage());
            return TokenValidationResult.invalid("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("Unsupported JWT: {}", e.getMessage());
            return TokenValidationResult.invalid("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT rejected: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            return TokenValidationResult.invalid("Empty or null token");
        }
    }
}
