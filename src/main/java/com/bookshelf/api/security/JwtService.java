package com.bookshelf.api.security;

import com.bookshelf.api.config.JwtProperties;
import com.bookshelf.api.entity.Role;
import com.bookshelf.api.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies HS256 bearer tokens.
 *
 * <p>A token carries the user id as {@code sub}, plus {@code email}, {@code name},
 * {@code roles} and a random {@code jti}. Its lifetime is fixed at {@link #TOKEN_LIFETIME};
 * there is no refresh or revocation. {@code iat} is truncated to whole seconds so that
 * {@code exp - iat} is exactly the lifetime once both are encoded as epoch seconds.
 *
 * <p>Verification checks signature, issuer, audience and expiry. Any failure surfaces as
 * a {@link JwtException} (or {@link IllegalArgumentException} for a malformed
 * subject); callers do not distinguish between the causes.
 */
@Service
public class JwtService {

    public static final Duration TOKEN_LIFETIME = Duration.ofHours(24);

    static final String EMAIL_CLAIM = "email";
    static final String NAME_CLAIM = "name";
    static final String ROLES_CLAIM = "roles";

    private final JwtProperties properties;
    private final SecretKey signingKey;
    private final JwtParser parser;

    public JwtService(JwtProperties properties) {
        if (!StringUtils.hasText(properties.secret())) {
            throw new IllegalStateException("JWT secret is not configured");
        }
        this.properties = properties;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
            .setSigningKey(signingKey)
            .requireIssuer(properties.issuer())
            .requireAudience(properties.audience())
            .build();
    }

    public IssuedToken issue(User user) {
        Instant issuedAt = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(TOKEN_LIFETIME);
        String displayName = StringUtils.hasText(user.getFullName()) ? user.getFullName() : user.getEmail();
        List<String> roles = user.getRoles().stream()
            .map(Role::name)
            .sorted()
            .toList();

        String token = Jwts.builder()
            .setSubject(user.getId().toString())
            .setId(UUID.randomUUID().toString())
            .setIssuer(properties.issuer())
            .setAudience(properties.audience())
            .setIssuedAt(Date.from(issuedAt))
            .setExpiration(Date.from(expiresAt))
            .claim(EMAIL_CLAIM, user.getEmail())
            .claim(NAME_CLAIM, displayName)
            .claim(ROLES_CLAIM, roles)
            .signWith(signingKey, SignatureAlgorithm.HS256)
            .compact();

        return new IssuedToken(token, expiresAt);
    }

    public AuthenticatedUser verify(String token) {
        Claims claims = parser.parseClaimsJws(token).getBody();
        if (!StringUtils.hasText(claims.getSubject())) {
            throw new MalformedJwtException("Token has no subject");
        }
        return new AuthenticatedUser(
            UUID.fromString(claims.getSubject()),
            claims.get(EMAIL_CLAIM, String.class),
            claims.get(NAME_CLAIM, String.class),
            readRoles(claims)
        );
    }

    private List<String> readRoles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        if (raw instanceof List<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
