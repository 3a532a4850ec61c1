package com.example.chatstream.service.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * StreamSink de tests: registra los eventos como "delta:x", "done", "error:msg".
 * Puede simular que el cliente se va tras N fragmentos.
 */
public class RecordingSink implements StreamSink {

    private final List<String> events = new ArrayList<>();
    private final int disconnectAfterDeltas;
    private final boolean failOnSend;
    private int deltas;
    private boolean open;
    private boolean closed;

    private RecordingSink(int disconnectAfterDeltas, boolean failOnSend) {
        this.disconnectAfterDeltas = disconnectAfterDeltas;
        this.failOnSend = failOnSend;
        this.open = failOnSend || disconnectAfterDeltas > 0;
    }

    public static RecordingSink connected() {
        return new RecordingSink(Integer.MAX_VALUE, false);
    }

    /**
     * El cliente deja de escuchar después de recibir {@code n} fragmentos.
     */
    public static RecordingSink disconnectingAfter(int n) {
        return new RecordingSink(n, false);
    }

    /**
     * Parece abierto, pero el envío que sigue al fragmento {@code n} falla.
     */
    public static RecordingSink failingSendAfter(int n) {
        return new RecordingSink(n, true);
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public synchronized boolean sendDelta(String text) {
        if (!open) {
            return false;
        }
        if (failOnSend && deltas >= disconnectAfterDeltas) {
            open = false;
            return false;
        }
        events.add("delta:" + text);
        deltas++;
        if (!failOnSend && deltas >= disconnectAfterDeltas) {
            open = false;
        }
        return true;
    }

    @Override
    public synchronized void sendDone() {
        if (open) {
            events.add("done");
            open = false;
        }
    }

    @Override
    public synchronized void sendError(String message) {
        if (open) {
            events.add("error:" + message);
            open = false;
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        open = false;
    }

    public synchronized List<String> events() {
        return List.copyOf(events);
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
