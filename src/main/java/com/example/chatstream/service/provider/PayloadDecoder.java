package com.example.chatstream.service.provider;

import java.io.IOException;

/**
 * Traduce una línea del cuerpo de respuesta de un proveedor.
 * Lanza {@link IOException} (p. ej. JSON inválido) si la línea está malformada.
 */
@FunctionalInterface
interface PayloadDecoder {

    StreamChunk decode(String line) throws IOException;
}
