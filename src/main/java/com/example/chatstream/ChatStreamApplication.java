package com.example.chatstream;

import com.example.chatstream.config.AiProvidersProperties;
import com.example.chatstream.config.ChatStreamProperties;
import com.example.chatstream.config.CorsProperties;
import com.example.chatstream.config.JwtProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AiProvidersProperties.class,
        ChatStreamProperties.class,
        JwtProperties.class,
        CorsProperties.class
})
public class ChatStreamApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatStreamApplication.class, args);
    }
}
