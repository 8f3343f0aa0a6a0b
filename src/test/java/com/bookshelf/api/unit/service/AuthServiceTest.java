package com.bookshelf.api.unit.service;

import com.bookshelf.api.dto.request.LoginRequest;
import com.bookshelf.api.dto.request.RegisterRequest;
import com.bookshelf.api.dto.response.AuthResponse;
import com.bookshelf.api.entity.Role;
import com.bookshelf.api.entity.User;
import com.bookshelf.api.exception.EmailAlreadyExistsException;
import com.bookshelf.api.exception.InvalidCredentialsException;
import com.bookshelf.api.repository.UserRepository;
import com.bookshelf.api.security.IssuedToken;
import com.bookshelf.api.security.JwtService;
import com.bookshelf.api.service.AuthService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant EXPIRES_AT = Instant.parse("2030-01-02T00:00:00Z");

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtService jwtService;

    @InjectMocks
    private AuthService authService;

    @Test
    void register_normalizesEmailHashesPasswordAndAssignsUserRole() {
        when(userRepository.existsByEmail("ann@example.com")).thenReturn(false);
        when(passwordEncoder.encode("Secret#123")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });
        when(jwtService.issue(any(User.class))).thenReturn(new IssuedToken("jwt", EXPIRES_AT));

        AuthResponse response = authService.register(
            new RegisterRequest("  Ann@Example.COM ", "Secret#123", "Ann Reader"));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).saveAndFlush(captor.capture());
        User stored = captor.getValue();
        assertThat(stored.getEmail()).isEqualTo("ann@example.com");
        assertThat(stored.getPasswordHash()).isEqualTo("hashed");
        assertThat(stored.getRoles()).containsExactly(Role.USER);

        assertThat(response.token()).isEqualTo("jwt");
        assertThat(response.email()).isEqualTo("ann@example.com");
        assertThat(response.expiration()).isEqualTo(EXPIRES_AT);
    }

    @Test
    void register_withTakenEmail_throwsEmailAlreadyExists() {
        when(userRepository.existsByEmail("ann@example.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(
                new RegisterRequest("ANN@example.com", "Secret#123", "Ann")))
            .isInstanceOf(EmailAlreadyExistsException.class);

        verify(userRepository, never()).saveAndFlush(any());
        verify(jwtService, never()).issue(any());
    }

    @Test
    void login_withMatchingPassword_issuesToken() {
        User user = createTestUser("ann@example.com", "hashed");
        when(userRepository.findByEmail("ann@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("Secret#123", "hashed")).thenReturn(true);
        when(jwtService.issue(user)).thenReturn(new IssuedToken("jwt", EXPIRES_AT));

        AuthResponse response = authService.login(new LoginRequest("Ann@example.com", "Secret#123"));

        assertThat(response.token()).isEqualTo("jwt");
        assertThat(response.email()).isEqualTo("ann@example.com");
    }

    @Test
    void login_withWrongPassword_throwsInvalidCredentials() {
        User user = createTestUser("ann@example.com", "hashed");
        when(userRepository.findByEmail("ann@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);

        assertThatThrownBy(() -> authService.login(new LoginRequest("ann@example.com", "wrong")))
            .isInstanceOf(InvalidCredentialsException.class)
            .hasMessage("Invalid email or password");

        verify(jwtService, never()).issue(any());
    }

    @Test
    void login_withUnknownEmail_throwsSameInvalidCredentials() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login(new LoginRequest("ghost@example.com", "Secret#123")))
            .isInstanceOf(InvalidCredentialsException.class)
            .hasMessage("Invalid email or password");
    }

    private User createTestUser(String email, String hash) {
        User user = new User();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setEmail(email);
        user.setPasswordHash(hash);
        user.setFullName("Ann Reader");
        user.getRoles().add(Role.USER);
        return user;
    }
}
