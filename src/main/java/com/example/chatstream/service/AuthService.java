package com.example.chatstream.service;

import com.example.chatstream.model.dto.TokenResponse;
import com.example.chatstream.model.dto.UserDto;
import com.example.chatstream.model.entity.AppUser;
import com.example.chatstream.repository.AppUserRepository;
import com.example.chatstream.security.JwtService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository repo;
    private final PasswordEncoder encoder;
    private final JwtService jwtService;

    public AuthService(AppUserRepository repo, PasswordEncoder encoder, JwtService jwtService) {
        this.repo = repo;
        this.encoder = encoder;
        this.jwtService = jwtService;
    }

    @Transactional
    public UserDto register(String username, String email, String rawPassword) {
        String u = username == null ? "" : username.trim();
        String e = normalizeEmail(email);

        if (u.length() < 3) throw new IllegalArgumentException("Usuario demasiado corto (mín 3).");
        if (e.isEmpty()) throw new IllegalArgumentException("Email requerido.");
        if (rawPassword == null || rawPassword.length() < 8)
            throw new IllegalArgumentException("Contraseña demasiado corta (mín 8).");

        if (repo.existsByUsername(u))
            throw new IllegalArgumentException("Ese usuario ya existe.");
        if (repo.existsByEmail(e))
            throw new IllegalArgumentException("Ese email ya está registrado.");

        AppUser user = new AppUser();
        user.setUsername(u);
        user.setEmail(e);
        user.setPasswordHash(encoder.encode(rawPassword));

        user = repo.save(user);
        log.info("Usuario registrado id={} username={}", user.getId(), u);
        return UserDto.from(user);
    }

    @Transactional
    public TokenResponse login(String email, String rawPassword) {
        AppUser user = repo.findByEmail(normalizeEmail(email))
                .filter(u -> rawPassword != null && encoder.matches(rawPassword, u.getPasswordHash()))
                .orElseThrow(() -> new BadCredentialsException("Email o contraseña incorrectos"));

        user.setLastLogin(Instant.now());
        repo.save(user);

        return TokenResponse.bearer(jwtService.issue(user.getEmail()), jwtService.expiresInSeconds());
    }

    @Transactional(readOnly = true)
    public UserDto me(String email) {
        return UserDto.from(requireUser(email));
    }

    /**
     * Usuario autenticado; el filtro JWT ya comprobó que existía.
     */
    public AppUser requireUser(String email) {
        return repo.findByEmail(email)
                .orElseThrow(() -> new IllegalStateException("Usuario autenticado no existe en BD: " + email));
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
