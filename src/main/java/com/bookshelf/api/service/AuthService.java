package com.bookshelf.api.service;

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
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new EmailAlreadyExistsException();
        }

        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFullName(request.fullName().trim());
        user.getRoles().add(Role.USER);

        // Flush so a concurrent registration trips idx_users_email here, not at commit.
        User saved = userRepository.saveAndFlush(user);
        log.info("Registered user {}", saved.getId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        String email = normalizeEmail(request.email());
        User user = userRepository.findByEmail(email)
            .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPasswordHash()))
            .orElseThrow(() -> {
                log.warn("Rejected login attempt");
                return new InvalidCredentialsException();
            });

        log.info("User {} logged in", user.getId());
        return toResponse(user);
    }

    private AuthResponse toResponse(User user) {
        IssuedToken issued = jwtService.issue(user);
        return new AuthResponse(issued.token(), user.getEmail(), issued.expiresAt());
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
