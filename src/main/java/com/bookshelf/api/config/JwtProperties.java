package com.bookshelf.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JWT settings bound from {@code app.jwt.*}.
 *
 * @param secret   HMAC-SHA256 signing secret, at least 32 bytes once UTF-8 encoded
 * @param issuer   value written to and required in the {@code iss} claim
 * @param audience value written to and required in the {@code aud} claim
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(String secret, String issuer, String audience) {}
