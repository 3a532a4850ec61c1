package com.example.chatstream.service.provider;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderStreamReaderTest {

    private final AtomicInteger connectionCloses = new AtomicInteger();
    private final Closeable connection = connectionCloses::incrementAndGet;

    /**
     * "t:x" = texto, "e" = vacío, "end" = fin, "err" = error, cualquier otra cosa = malformada.
     */
    private static StreamChunk decode(String line) throws IOException {
        if (line.startsWith("t:")) return StreamChunk.text(line.substring(2));
        if (line.equals("e")) return StreamChunk.empty();
        if (line.equals("end")) return StreamChunk.end();
        if (line.equals("err")) return StreamChunk.error("fallo saneado");
        throw new IOException("linea malformada");
    }

    private ProviderStreamReader reader(String body) {
        InputStream in = new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
        return new ProviderStreamReader("fake", in, connection, ProviderStreamReaderTest::decode);
    }

    @Test
    void skipsEmptyPayloadsAndBlankLines() {
        try (ProviderStreamReader r = reader("t:a\n\ne\nt:b\n   \nend\nt:ignorado\n")) {
            assertEquals(List.of("a", "b"), OpenAiChatProviderTest.drain(r));
        }
        assertEquals(1, connectionCloses.get());
    }

    @Test
    void malformedLinesAreSkippedWhenOthersAreValid() {
        try (ProviderStreamReader r = reader("t:a\n{roto\nt:b\n")) {
            assertEquals(List.of("a", "b"), OpenAiChatProviderTest.drain(r));
        }
    }

    @Test
    void streamMadeOnlyOfMalformedLinesFails() {
        try (ProviderStreamReader r = reader("{roto\n<html>\n")) {
            ProviderException ex = assertThrows(ProviderException.class, r::hasNext);
            assertEquals("fake", ex.getProviderId());
        }
        assertEquals(1, connectionCloses.get());
    }

    @Test
    void tooManyConsecutiveMalformedLinesFailEarly() {
        StringBuilder body = new StringBuilder("t:a\n");
        for (int i = 0; i < ProviderStreamReader.MAX_CONSECUTIVE_MALFORMED; i++) {
            body.append("basura\n");
        }
        body.append("t:b\n");

        try (ProviderStreamReader r = reader(body.toString())) {
            assertEquals("a", r.next());
            assertThrows(ProviderException.class, r::hasNext);
        }
    }

    @Test
    void errorChunkClosesConnectionAndRaises() {
        ProviderStreamReader r = reader("t:a\nerr\nt:b\n");
        assertEquals("a", r.next());
        ProviderException ex = assertThrows(ProviderException.class, r::hasNext);
        assertEquals("fallo saneado", ex.getMessage());
        assertEquals(1, connectionCloses.get());
        assertFalse(r.hasNext());
    }

    @Test
    void earlyCloseReleasesConnectionOnce() {
        ProviderStreamReader r = reader("t:a\nt:b\nt:c\n");
        assertTrue(r.hasNext());
        r.close();
        r.close();

        assertEquals(1, connectionCloses.get());
        assertTrue(r.hasNext(), "el fragmento ya leído sigue disponible");
        assertEquals("a", r.next());
        assertFalse(r.hasNext());
    }

    @Test
    void ioFailureBecomesProviderException() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        ProviderStreamReader r = new ProviderStreamReader("fake", broken, connection, ProviderStreamReaderTest::decode);

        ProviderException ex = assertThrows(ProviderException.class, r::hasNext);
        assertFalse(ex.getMessage().contains("connection reset"));
        assertEquals(1, connectionCloses.get());
    }
}
