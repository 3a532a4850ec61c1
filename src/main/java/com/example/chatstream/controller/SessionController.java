package com.example.chatstream.controller;

import com.example.chatstream.model.dto.RenameSessionRequest;
import com.example.chatstream.model.dto.SessionCreateRequest;
import com.example.chatstream.model.dto.SessionDetailsDto;
import com.example.chatstream.model.dto.SessionSummaryDto;
import com.example.chatstream.service.ChatSessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final ChatSessionService sessionService;

    public SessionController(ChatSessionService sessionService) {
        this.sessionService = sessionService;
    }

    // ---------------------------------------------------------------------
    // LISTAR CHATS DEL USUARIO
    // Más recientes primero, con nº de mensajes y fecha del último.
    // ---------------------------------------------------------------------
    @GetMapping
    public List<SessionSummaryDto> list(Principal principal) {
        return sessionService.listSessions(principal.getName());
    }

    @PostMapping
    public ResponseEntity<SessionSummaryDto> create(@RequestBody(required = false) SessionCreateRequest req,
                                                    Principal principal) {
        String title = req == null ? null : req.getTitle();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionService.createSession(principal.getName(), title));
    }

    @GetMapping("/{sessionId}")
    public SessionDetailsDto details(@PathVariable String sessionId, Principal principal) {
        return sessionService.sessionDetails(principal.getName(), sessionId);
    }

    @PutMapping("/{sessionId}")
    public SessionSummaryDto rename(@PathVariable String sessionId,
                                    @Valid @RequestBody RenameSessionRequest req,
                                    Principal principal) {
        return sessionService.renameSession(principal.getName(), sessionId, req.getTitle());
    }

    // ---------------------------------------------------------------------
    // BORRAR CHAT
    // Borra la sesión y todos sus mensajes.
    // ---------------------------------------------------------------------
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable String sessionId, Principal principal) {
        sessionService.deleteSession(principal.getName(), sessionId);
        return ResponseEntity.noContent().build();
    }
}
