package com.example.chatstream.service.stream;

import com.example.chatstream.config.ChatStreamProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Timeout según chat.stream.emitter-timeout-ms; 0 deja el stream sin límite.
 */
@Component
public class DefaultStreamEmitterFactory implements StreamEmitterFactory {

    private final ChatStreamProperties props;

    public DefaultStreamEmitterFactory(ChatStreamProperties props) {
        this.props = props;
    }

    @Override
    public ResponseBodyEmitter create() {
        return new ResponseBodyEmitter(Math.max(0L, props.getEmitterTimeoutMs()));
    }
}
