package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties;
import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRegistryTest {

    private AiProvidersProperties props;
    private ProviderRegistry registry;

    @BeforeEach
    void setUp() {
        props = new AiProvidersProperties();
        props.getProviders().put("openai", new ProviderSettings("sk-test", null));
        registry = new ProviderRegistry(props, new JdkClientHttpRequestFactory());
    }

    @Test
    void knowsTheFourBuiltInProviders() {
        assertEquals(Set.of("anthropic", "gemini", "ollama", "openai"), registry.providerIds());
        assertInstanceOf(OpenAiChatProvider.class, registry.resolve("openai"));
        assertInstanceOf(GeminiChatProvider.class, registry.resolve("gemini"));
        assertInstanceOf(AnthropicChatProvider.class, registry.resolve("anthropic"));
        assertInstanceOf(OllamaChatProvider.class, registry.resolve("ollama"));
    }

    @Test
    void resolveIsCaseInsensitiveAndReturnsFreshInstances() {
        ChatProvider first = registry.resolve(" OpenAI ");
        ChatProvider second = registry.resolve("openai");
        assertEquals("openai", first.id());
        assertNotSame(first, second);
    }

    @Test
    void unknownProviderFailsClosed() {
        UnsupportedProviderException ex = assertThrows(UnsupportedProviderException.class,
                () -> registry.resolve("cohere"));
        assertEquals("cohere", ex.getProviderId());
        assertTrue(ex.getMessage().contains("openai"));

        assertThrows(UnsupportedProviderException.class, () -> registry.resolve(null));
        assertThrows(UnsupportedProviderException.class, () -> registry.resolve("  "));
        assertFalse(registry.supports("cohere"));
    }

    @Test
    void registrationExtendsTheKnownSet() {
        ChatProvider fake = new ChatProvider() {
            @Override
            public String id() {
                return "fake";
            }

            @Override
            public TokenStream streamChat(String prompt, String model, List<ChatTurn> history) {
                return FakeTokenStream.of();
            }
        };
        registry.register("Fake", (settings, builder) -> fake);

        assertTrue(registry.supports("fake"));
        assertSame(fake, registry.resolve("fake"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", (s, b) -> fake));
    }
}
