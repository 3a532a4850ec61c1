package com.example.chatstream.service;

import com.example.chatstream.config.ChatStreamProperties;
import com.example.chatstream.service.stream.StreamSink;
import com.example.chatstream.service.stream.StreamTicket;
import com.example.chatstream.util.RequestIdHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lanza cada stream como una tarea del pool {@code chatStreamExecutor}.
 *
 * <p>Con {@code chat.stream.serialize-per-session=true} los streams de una misma sesión
 * se ejecutan de uno en uno y en orden de llegada; sin ella no hay orden entre peticiones
 * concurrentes de la misma sesión.
 */
@Service
public class ChatStreamDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamDispatcher.class);

    static final String BUSY_MESSAGE = "El servidor está ocupado, inténtalo de nuevo en unos segundos";

    private final ChatStreamOrchestrator orchestrator;
    private final TaskExecutor executor;
    private final ChatStreamProperties properties;
    private final Map<String, SessionQueue> sessionQueues = new ConcurrentHashMap<>();

    public ChatStreamDispatcher(ChatStreamOrchestrator orchestrator,
                                @Qualifier("chatStreamExecutor") TaskExecutor executor,
                                ChatStreamProperties properties) {
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.properties = properties;
    }

    public void dispatch(StreamTicket ticket, StreamSink sink) {
        QueuedStream queued = new QueuedStream(ticket, sink);
        if (!properties.isSerializePerSession()) {
            submit(RequestIdHolder.propagate(() -> runSafely(queued)), queued);
            return;
        }

        String queueKey = ticket.sessionId();
        // alta y arranque atómicos respecto a la limpieza de la cola (misma clave del mapa)
        AtomicBoolean start = new AtomicBoolean();
        SessionQueue queue = sessionQueues.compute(queueKey, (key, current) -> {
            SessionQueue target = current == null ? new SessionQueue() : current;
            target.enqueue(queued);
            start.set(target.markProcessing());
            return target;
        });
        if (start.get()) {
            startProcessing(queueKey, queue);
        }
    }

    private void startProcessing(String queueKey, SessionQueue queue) {
        Runnable task = RequestIdHolder.propagate(() -> processQueue(queueKey, queue));
        try {
            executor.execute(task);
        } catch (TaskRejectedException e) {
            // nadie va a vaciar la cola: se rechaza todo lo pendiente
            log.warn("Pool de streaming lleno, se rechaza la cola de la sesión {}", queueKey);
            List<QueuedStream> rejected = new ArrayList<>();
            sessionQueues.computeIfPresent(queueKey, (key, current) -> {
                if (current != queue) {
                    return current;
                }
                rejected.addAll(current.drainAndStop());
                return null;
            });
            rejected.forEach(q -> q.sink().sendError(BUSY_MESSAGE));
        }
    }

    private void processQueue(String queueKey, SessionQueue queue) {
        while (true) {
            QueuedStream next = queue.poll();
            if (next == null) {
                if (releaseIfIdle(queueKey, queue)) {
                    return;
                }
                // entró algo justo después del poll
                continue;
            }
            runSafely(next);
        }
    }

    /**
     * Suelta la cola y la quita del mapa en un solo paso, solo si no queda nada pendiente.
     */
    private boolean releaseIfIdle(String queueKey, SessionQueue queue) {
        AtomicBoolean released = new AtomicBoolean();
        sessionQueues.compute(queueKey, (key, current) -> {
            if (current != queue) {
                // la cola ya no está registrada: nadie más puede encolar en ella
                released.set(true);
                return current;
            }
            if (!current.stopProcessingIfIdle()) {
                return current;
            }
            released.set(true);
            return null;
        });
        return released.get();
    }

    private void submit(Runnable task, QueuedStream queued) {
        try {
            executor.execute(task);
        } catch (TaskRejectedException e) {
            log.warn("Pool de streaming lleno, stream rechazado session={}", queued.ticket().sessionId());
            queued.sink().sendError(BUSY_MESSAGE);
        }
    }

    private void runSafely(QueuedStream queued) {
        try {
            orchestrator.run(queued.ticket(), queued.sink());
        } catch (RuntimeException e) {
            log.error("Stream abortado session={}", queued.ticket().sessionId(), e);
            queued.sink().sendError(ChatStreamOrchestrator.INTERNAL_ERROR_MESSAGE);
        }
    }

    int pendingSessionQueues() {
        return sessionQueues.size();
    }

    /**
     * Cola interna por sesión (FIFO).
     */
    private static final class SessionQueue {
        private final Deque<QueuedStream> queue = new ArrayDeque<>();
        private boolean processing;

        synchronized void enqueue(QueuedStream stream) {
            queue.addLast(stream);
        }

        synchronized QueuedStream poll() {
            return queue.pollFirst();
        }

        synchronized boolean markProcessing() {
            if (processing) {
                return false;
            }
            processing = true;
            return true;
        }

        /**
         * Libera el flag solo si la cola está vacía.
         */
        synchronized boolean stopProcessingIfIdle() {
            if (!queue.isEmpty()) {
                return false;
            }
            processing = false;
            return true;
        }

        synchronized Deque<QueuedStream> drainAndStop() {
            Deque<QueuedStream> drained = new ArrayDeque<>(queue);
            queue.clear();
            processing = false;
            return drained;
        }

    }

    private record QueuedStream(StreamTicket ticket, StreamSink sink) {
    }
}
