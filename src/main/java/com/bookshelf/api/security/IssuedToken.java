package com.bookshelf.api.security;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {}
