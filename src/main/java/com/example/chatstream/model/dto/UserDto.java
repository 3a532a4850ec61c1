package com.example.chatstream.model.dto;

import com.example.chatstream.model.entity.AppUser;

import java.time.Instant;

public record UserDto(Long id, String username, String email, Instant createdAt, Instant lastLogin) {

    public static UserDto from(AppUser u) {
        return new UserDto(u.getId(), u.getUsername(), u.getEmail(), u.getCreatedAt(), u.getLastLogin());
    }
}
