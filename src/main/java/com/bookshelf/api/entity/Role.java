package com.bookshelf.api.entity;

/**
 * Roles granted to a {@link User}. Stored by name in {@code user_roles.role} and exposed
 * to Spring Security as {@code ROLE_<name>} authorities.
 */
public enum Role {
    USER,
    ADMIN
}
