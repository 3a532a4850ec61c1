package com.example.chatstream.service.stream;

import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Crea los emitters de /chat/stream. Separado para poder sustituirlo en tests.
 */
@FunctionalInterface
public interface StreamEmitterFactory {

    ResponseBodyEmitter create();
}
