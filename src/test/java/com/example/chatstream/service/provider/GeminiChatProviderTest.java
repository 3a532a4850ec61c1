package com.example.chatstream.service.provider;

import com.example.chatstream.config.AiProvidersProperties.ProviderSettings;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiChatProviderTest {

    @Test
    void mapsAssistantRoleToModelAndJoinsParts() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        GeminiChatProvider provider = new GeminiChatProvider(new ProviderSettings("g-key", null), builder);

        server.expect(requestTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:streamGenerateContent?alt=sse"))
                .andExpect(header("x-goog-api-key", "g-key"))
                .andExpect(jsonPath("$.contents.length()").value(3))
                .andExpect(jsonPath("$.contents[1].role").value("model"))
                .andExpect(jsonPath("$.contents[2].parts[0].text").value("sigue"))
                .andRespond(withSuccess("""
                        data: {"candidates":[{"content":{"role":"model","parts":[{"text":"uno "},{"text":"dos"}]}}]}

                        data: {"candidates":[{"content":{"role":"model","parts":[{"text":""}]},"finishReason":"STOP"}]}

                        data: {"candidates":[{"content":{"role":"model","parts":[{"text":" tres"}]}}]}

                        """, MediaType.TEXT_EVENT_STREAM));

        List<ChatTurn> history = List.of(
                new ChatTurn(ChatTurn.USER, "cuenta"),
                new ChatTurn(ChatTurn.ASSISTANT, "cero"));

        try (TokenStream tokens = provider.streamChat("sigue", "gemini-1.5-flash", history)) {
            assertEquals(List.of("uno dos", " tres"), OpenAiChatProviderTest.drain(tokens));
        }
        server.verify();
    }
}
