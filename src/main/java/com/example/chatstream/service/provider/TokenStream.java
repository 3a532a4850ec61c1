package com.example.chatstream.service.provider;

import java.util.Iterator;

/**
 * Fragmentos de texto de una respuesta en curso. Se consumen de uno en uno;
 * {@link #close()} libera la conexión aunque no se haya leído todo.
 * {@code hasNext()} y {@code next()} pueden lanzar {@link ProviderException}.
 */
public interface TokenStream extends Iterator<String>, AutoCloseable {

    @Override
    void close();
}
