package com.example.chatstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "security.jwt")
public class JwtProperties {

    /**
     * Secreto HMAC (mínimo 32 bytes para HS256).
     */
    private String secret;

    private Duration expiration = Duration.ofMinutes(30);

    public String getSecret() { return secret; }
    public void setSecret(String secret) { this.secret = secret; }

    public Duration getExpiration() { return expiration; }
    public void setExpiration(Duration expiration) { this.expiration = expiration; }
}
