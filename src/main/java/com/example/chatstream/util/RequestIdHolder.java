package com.example.chatstream.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * requestId del hilo actual, reflejado en el MDC para que aparezca en los logs.
 * Los streams se ejecutan en otro hilo: usar {@link #propagate(Runnable)} al encolarlos.
 */
public final class RequestIdHolder {

    public static final String MDC_KEY = "requestId";

    private RequestIdHolder() {
    }

    public static String get() {
        String id = MDC.get(MDC_KEY);
        return (id == null || id.isBlank()) ? null : id;
    }

    public static String ensure() {
        String id = get();
        if (id == null) {
            id = generate();
            set(id);
        }
        return id;
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static void set(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            clear();
            return;
        }
        MDC.put(MDC_KEY, requestId);
    }

    public static Scope use(String requestId) {
        String previous = get();
        set(requestId);
        return new Scope(previous);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * Envuelve la tarea para que corra con el requestId del hilo que la crea.
     */
    public static Runnable propagate(Runnable task) {
        String captured = get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (var ignored = use(captured)) {
                task.run();
            }
        };
    }

    public static final class Scope implements AutoCloseable {
        private final String previous;

        private Scope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                clear();
                return;
            }
            set(previous);
        }
    }
}
