package com.example.chatstream.service;

import com.example.chatstream.config.ChatStreamProperties;
import com.example.chatstream.model.dto.ChatStreamRequest;
import com.example.chatstream.model.entity.AppUser;
import com.example.chatstream.model.entity.ChatMessage;
import com.example.chatstream.service.provider.ChatProvider;
import com.example.chatstream.service.provider.ChatTurn;
import com.example.chatstream.service.provider.ProviderException;
import com.example.chatstream.service.provider.ProviderRegistry;
import com.example.chatstream.service.provider.TokenStream;
import com.example.chatstream.service.provider.UnsupportedProviderException;
import com.example.chatstream.service.stream.StreamOutcome;
import com.example.chatstream.service.stream.StreamSink;
import com.example.chatstream.service.stream.StreamState;
import com.example.chatstream.service.stream.StreamTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Un turno de chat en streaming.
 *
 * <p>Orden fijo: guardar el prompt, cargar el historial anterior, resolver el proveedor
 * y reenviar sus fragmentos al cliente. Al terminar se guarda lo acumulado como mensaje
 * del asistente, tanto si el stream acabó bien como si el cliente se fue o el proveedor
 * falló. Los errores posteriores a guardar el prompt se comunican por el propio stream.
 *
 * <p>No hay reintentos: cada petición termina en COMPLETED, DISCONNECTED o FAILED.
 */
@Service
public class ChatStreamOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamOrchestrator.class);

    static final String STORE_ERROR_MESSAGE = "No se pudo guardar la conversación";
    static final String INTERNAL_ERROR_MESSAGE = "Error interno generando la respuesta";
    static final String CANCELLED_MESSAGE = "La respuesta se canceló en el servidor";

    private final AuthService authService;
    private final ConversationStore store;
    private final HistoryAssembler historyAssembler;
    private final ProviderRegistry registry;
    private final ChatStreamProperties props;

    public ChatStreamOrchestrator(AuthService authService,
                                  ConversationStore store,
                                  HistoryAssembler historyAssembler,
                                  ProviderRegistry registry,
                                  ChatStreamProperties props) {
        this.authService = authService;
        this.store = store;
        this.historyAssembler = historyAssembler;
        this.registry = registry;
        this.props = props;
    }

    // =========================================================================
    // INIT
    // =========================================================================

    /**
     * Valida la petición antes de abrir el stream. No escribe nada.
     *
     * @throws SessionNotFoundException si la sesión no existe o es de otro usuario
     */
    public StreamTicket prepare(String email, ChatStreamRequest request) {
        AppUser user = authService.requireUser(email);
        if (!store.isOwnedBy(request.sessionId(), user.getId())) {
            throw new SessionNotFoundException(request.sessionId());
        }
        return new StreamTicket(user.getId(), request.sessionId(), request.prompt(), request.provider(), request.model());
    }

    // =========================================================================
    // USER_SAVED -> STREAMING -> terminal
    // =========================================================================

    public StreamOutcome run(StreamTicket ticket, StreamSink sink) {
        StreamRun run = new StreamRun(ticket);

        ChatMessage userMessage;
        try {
            userMessage = store.appendMessage(ticket.sessionId(), ChatMessage.Role.USER, ticket.prompt(), ticket.userId());
        } catch (RuntimeException e) {
            // sin prompt guardado no hay nada que acumular
            log.error("No se pudo guardar el prompt session={}", ticket.sessionId(), e);
            run.to(StreamState.FAILED);
            sink.sendError(clientMessage(e));
            return run.finish(0);
        }
        run.to(StreamState.USER_SAVED);

        StringBuilder accumulator = new StringBuilder();
        RuntimeException failure = null;

        try {
            List<ChatTurn> history = historyAssembler.load(ticket.sessionId(), ticket.userId(), userMessage.getId());
            ChatProvider provider = registry.resolve(ticket.providerId());
            run.to(StreamState.STREAMING);

            StreamState reached;
            try (TokenStream tokens = provider.streamChat(ticket.prompt(), ticket.model(), history)) {
                reached = relay(tokens, sink, accumulator, run);
            }
            run.to(reached);
        } catch (RuntimeException e) {
            failure = e;
            run.to(StreamState.FAILED);
        }

        StreamOutcome outcome = finish(run, sink, accumulator, failure);
        if (failure instanceof StreamCancelledException) {
            // el flag se restaura después de guardar lo acumulado
            Thread.currentThread().interrupt();
        }
        return outcome;
    }

    /**
     * Reenvía fragmentos mientras el cliente siga conectado. Devuelve el estado terminal
     * alcanzado sin fallo (COMPLETED o DISCONNECTED).
     */
    private StreamState relay(TokenStream tokens, StreamSink sink, StringBuilder accumulator, StreamRun run) {
        while (true) {
            if (!sink.isOpen()) {
                return StreamState.DISCONNECTED;
            }
            if (!tokens.hasNext()) {
                return StreamState.COMPLETED;
            }
            String fragment = tokens.next();
            if (fragment == null || fragment.isEmpty()) {
                continue;
            }
            if (!sink.isOpen() || !sink.sendDelta(fragment)) {
                // el fragmento no llegó al cliente: no forma parte de la respuesta
                return StreamState.DISCONNECTED;
            }
            accumulator.append(fragment);
            run.fragments++;
            pace();
        }
    }

    private StreamOutcome finish(StreamRun run, StreamSink sink, StringBuilder accumulator, RuntimeException failure) {
        StreamTicket ticket = run.ticket;
        int persisted = 0;
        boolean storeFailed = false;

        if (accumulator.length() > 0) {
            try {
                store.appendMessage(ticket.sessionId(), ChatMessage.Role.ASSISTANT, accumulator.toString(), ticket.userId());
                persisted = accumulator.length();
            } catch (RuntimeException e) {
                // estado del registro desconocido: se descarta lo acumulado
                log.error("No se pudo guardar la respuesta session={} state={}", ticket.sessionId(), run.state, e);
                storeFailed = true;
            }
        }
        accumulator.setLength(0);

        switch (run.state) {
            case COMPLETED -> {
                if (storeFailed) {
                    sink.sendError(STORE_ERROR_MESSAGE);
                } else {
                    sink.sendDone();
                }
            }
            case DISCONNECTED -> sink.close();
            case FAILED -> {
                logFailure(ticket, failure);
                sink.sendError(storeFailed ? STORE_ERROR_MESSAGE : clientMessage(failure));
            }
            default -> throw new IllegalStateException("Stream sin estado terminal: " + run.state);
        }

        return run.finish(persisted);
    }

    private void pace() {
        long pacing = props.getPacingMs();
        if (pacing <= 0) {
            return;
        }
        try {
            Thread.sleep(pacing);
        } catch (InterruptedException e) {
            // run() restaura el flag al terminar
            throw new StreamCancelledException(e);
        }
    }

    private void logFailure(StreamTicket ticket, RuntimeException failure) {
        if (failure instanceof ProviderException || failure instanceof UnsupportedProviderException) {
            log.warn("Stream fallido session={} provider={} model={}: {}",
                    ticket.sessionId(), ticket.providerId(), ticket.model(), failure.getMessage());
        } else {
            log.error("Stream fallido session={} provider={} model={}",
                    ticket.sessionId(), ticket.providerId(), ticket.model(), failure);
        }
    }

    /**
     * Mensaje seguro para el cliente: nunca el texto de una excepción inesperada.
     */
    static String clientMessage(RuntimeException e) {
        if (e instanceof ProviderException || e instanceof UnsupportedProviderException) {
            return e.getMessage();
        }
        if (e instanceof ConversationStoreException) {
            return STORE_ERROR_MESSAGE;
        }
        if (e instanceof StreamCancelledException) {
            return CANCELLED_MESSAGE;
        }
        return INTERNAL_ERROR_MESSAGE;
    }

    /**
     * Estado de una ejecución; solo avanza.
     */
    private static final class StreamRun {
        private final StreamTicket ticket;
        private StreamState state = StreamState.INIT;
        private int fragments;

        StreamRun(StreamTicket ticket) {
            this.ticket = ticket;
        }

        void to(StreamState next) {
            if (state.isTerminal() || next.ordinal() <= state.ordinal()) {
                throw new IllegalStateException("Transición no válida " + state + " -> " + next);
            }
            state = next;
        }

        StreamOutcome finish(int persistedChars) {
            log.info("Stream {} session={} provider={} model={} fragments={} persistedChars={}",
                    state, ticket.sessionId(), ticket.providerId(), ticket.model(), fragments, persistedChars);
            return new StreamOutcome(state, fragments, persistedChars);
        }
    }

    /**
     * El hilo del stream fue interrumpido (apagado del pool).
     */
    static final class StreamCancelledException extends RuntimeException {
        StreamCancelledException(InterruptedException cause) {
            super("Stream interrumpido", cause);
        }
    }
}
