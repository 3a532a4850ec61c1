package com.example.chatstream.controller;

import com.example.chatstream.model.dto.ChatMessageDto;
import com.example.chatstream.model.dto.SessionDetailsDto;
import com.example.chatstream.model.dto.SessionSummaryDto;
import com.example.chatstream.service.ChatSessionService;
import com.example.chatstream.service.SessionNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
@AutoConfigureMockMvc(addFilters = false)
class SessionControllerTest {

    private static final String EMAIL = "ana@example.com";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ChatSessionService sessionService;

    @Test
    void createWithoutBodyUsesDefaultTitle() throws Exception {
        when(sessionService.createSession(eq(EMAIL), isNull()))
                .thenReturn(new SessionSummaryDto("sid-1", "New Chat", Instant.now(), 0, null));

        mockMvc.perform(post("/sessions").principal(() -> EMAIL))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("sid-1"))
                .andExpect(jsonPath("$.title").value("New Chat"))
                .andExpect(jsonPath("$.message_count").value(0));
    }

    @Test
    void detailsListsMessagesInOrder() throws Exception {
        Instant now = Instant.now();
        when(sessionService.sessionDetails(EMAIL, "sid-1")).thenReturn(new SessionDetailsDto(
                "sid-1", "Charla", now, List.of(
                new ChatMessageDto(1L, "user", "hola", now),
                new ChatMessageDto(2L, "assistant", "buenas", now))));

        mockMvc.perform(get("/sessions/sid-1").principal(() -> EMAIL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("buenas"));
    }

    @Test
    void renameRequiresTitle() throws Exception {
        mockMvc.perform(put("/sessions/sid-1")
                        .principal(() -> EMAIL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deleteReturnsNoContentAndForeignSessionIsNotFound() throws Exception {
        mockMvc.perform(delete("/sessions/sid-1").principal(() -> EMAIL))
                .andExpect(status().isNoContent());
        verify(sessionService).deleteSession(EMAIL, "sid-1");

        doThrow(new SessionNotFoundException("ajena")).when(sessionService).deleteSession(EMAIL, "ajena");
        mockMvc.perform(delete("/sessions/ajena").principal(() -> EMAIL))
                .andExpect(status().isNotFound());
    }
}
