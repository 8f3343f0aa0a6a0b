package com.bookshelf.api.dto.response;

import java.time.Instant;

/**
 * Result of a successful register or login. {@code expiration} is the token's
 * {@code exp} claim.
 */
public record AuthResponse(
    String token,
    String email,
    Instant expiration
) {}
