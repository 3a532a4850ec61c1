package com.example.chatstream.controller;

import com.example.chatstream.model.dto.LoginRequest;
import com.example.chatstream.model.dto.RegisterRequest;
import com.example.chatstream.model.dto.TokenResponse;
import com.example.chatstream.model.dto.UserDto;
import com.example.chatstream.service.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserDto register(@Valid @RequestBody RegisterRequest req) {
        return authService.register(req.username(), req.email(), req.password());
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest req) {
        return authService.login(req.email(), req.password());
    }

    @GetMapping("/me")
    public UserDto me(Principal principal) {
        return authService.me(principal.getName());
    }
}
