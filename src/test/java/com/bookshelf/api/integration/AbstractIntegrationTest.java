package com.bookshelf.api.integration;

import com.bookshelf.api.dto.request.RegisterRequest;
import com.bookshelf.api.dto.response.AuthResponse;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for tests that run the full application against a real PostgreSQL.
 *
 * <p>The container is a JVM-wide singleton started on first use, so every subclass shares
 * one cached Spring context. Test classes are skipped when no Docker daemon is reachable.
 * Tables are truncated before each test and a fresh user is registered, whose token is
 * sent by the {@code get/post/put/delete} helpers.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

    protected static final String TEST_EMAIL = "reader@example.com";
    protected static final String TEST_PASSWORD = "Secret#123";

    @ServiceConnection
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        POSTGRES.start();
    }

    @Autowired
    protected TestRestTemplate restTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    protected String token;

    @BeforeEach
    protected void resetDatabaseAndAuthenticate() {
        jdbcTemplate.execute("TRUNCATE TABLE books, authors, user_roles, users RESTART IDENTITY CASCADE");
        ResponseEntity<AuthResponse> response = restTemplate.postForEntity("/api/auth/register",
            new RegisterRequest(TEST_EMAIL, TEST_PASSWORD, "Test Reader"), AuthResponse.class);
        token = response.getBody().token();
    }

    protected HttpHeaders bearer(String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(value);
        return headers;
    }

    protected <T> ResponseEntity<T> get(String url, Class<T> responseType) {
        return restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(bearer(token)), responseType);
    }

    protected <T> ResponseEntity<T> post(String url, Object body, Class<T> responseType) {
        return restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, bearer(token)), responseType);
    }

    protected <T> ResponseEntity<T> put(String url, Object body, Class<T> responseType) {
        return restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(body, bearer(token)), responseType);
    }

    protected <T> ResponseEntity<T> delete(String url, Class<T> responseType) {
        return restTemplate.exchange(url, HttpMethod.DELETE, new HttpEntity<>(bearer(token)), responseType);
    }

    protected int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }
}
