package com.example.chatstream.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class RequestIdHolderTest {

    @AfterEach
    void tearDown() {
        RequestIdHolder.clear();
    }

    @Test
    void scopeRestoresPreviousId() {
        RequestIdHolder.set("externo");
        try (var ignored = RequestIdHolder.use("interno")) {
            assertEquals("interno", RequestIdHolder.get());
        }
        assertEquals("externo", RequestIdHolder.get());
    }

    @Test
    void ensureGeneratesOnce() {
        assertNull(RequestIdHolder.get());
        String first = RequestIdHolder.ensure();
        assertNotNull(first);
        assertEquals(first, RequestIdHolder.ensure());
    }

    @Test
    void propagateCarriesIdToAnotherThread() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task;
        try (var ignored = RequestIdHolder.use("req-9")) {
            task = RequestIdHolder.propagate(() -> seen.set(RequestIdHolder.get()));
        }

        Thread worker = new Thread(task);
        worker.start();
        worker.join(2000);

        assertEquals("req-9", seen.get());
    }
}
