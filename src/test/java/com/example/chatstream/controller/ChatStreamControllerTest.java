package com.example.chatstream.controller;

import com.example.chatstream.model.dto.ChatStreamRequest;
import com.example.chatstream.service.ChatStreamDispatcher;
import com.example.chatstream.service.ChatStreamOrchestrator;
import com.example.chatstream.service.SessionNotFoundException;
import com.example.chatstream.service.stream.StreamEmitterFactory;
import com.example.chatstream.service.stream.StreamSink;
import com.example.chatstream.service.stream.StreamTicket;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatStreamController.class)
@AutoConfigureMockMvc(addFilters = false)
class ChatStreamControllerTest {

    private static final String BODY = """
            {"session_id":"sid-1","prompt":"Hola","provider":"openai","model":"gpt-4o-mini"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ChatStreamOrchestrator orchestrator;

    @MockitoBean
    private ChatStreamDispatcher dispatcher;

    @MockitoBean
    private StreamEmitterFactory emitterFactory;

    @Test
    void streamsEventFramesForOwnedSession() throws Exception {
        StreamTicket ticket = new StreamTicket(1L, "sid-1", "Hola", "openai", "gpt-4o-mini");
        when(orchestrator.prepare(eq("ana@example.com"), any(ChatStreamRequest.class))).thenReturn(ticket);
        when(emitterFactory.create()).thenReturn(new ResponseBodyEmitter());
        doAnswer(inv -> {
            StreamSink sink = inv.getArgument(1);
            sink.sendDelta("Hola");
            sink.sendDelta(" Ana");
            sink.sendDone();
            return null;
        }).when(dispatcher).dispatch(eq(ticket), any());

        MvcResult result = mockMvc.perform(post("/chat/stream")
                        .principal(() -> "ana@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(request().asyncStarted())
                .andReturn();

        assertEquals("data: {\"delta\":\"Hola\"}\n\n"
                        + "data: {\"delta\":\" Ana\"}\n\n"
                        + "data: [DONE]\n\n",
                result.getResponse().getContentAsString());
        assertTrue(result.getResponse().getContentType().startsWith(MediaType.TEXT_EVENT_STREAM_VALUE));
        assertEquals("no-cache", result.getResponse().getHeader("Cache-Control"));
    }

    @Test
    void foreignSessionIsNotFoundBeforeStreaming() throws Exception {
        when(orchestrator.prepare(eq("ana@example.com"), any(ChatStreamRequest.class)))
                .thenThrow(new SessionNotFoundException("sid-1"));

        mockMvc.perform(post("/chat/stream")
                        .principal(() -> "ana@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error_id").isNotEmpty());

        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    void missingFieldsAreRejected() throws Exception {
        mockMvc.perform(post("/chat/stream")
                        .principal(() -> "ana@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"session_id":"sid-1","prompt":"","provider":"openai"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").isArray());

        verify(orchestrator, never()).prepare(any(), any());
    }
}
