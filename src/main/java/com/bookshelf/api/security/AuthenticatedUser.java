package com.bookshelf.api.security;

import java.util.List;
import java.util.UUID;

/**
 * Principal attached to the security context once a bearer token has been verified.
 */
public record AuthenticatedUser(UUID id, String email, String fullName, List<String> roles) {}
