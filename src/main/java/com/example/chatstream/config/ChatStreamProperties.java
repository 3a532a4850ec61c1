package com.example.chatstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ajustes del streaming de respuestas.
 */
@ConfigurationProperties(prefix = "chat.stream")
public class ChatStreamProperties {

    /**
     * Pausa en milisegundos entre fragmentos enviados al cliente.
     */
    private long pacingMs = 10;

    /**
     * Timeout del emisor HTTP. 0 = sin timeout.
     */
    private long emitterTimeoutMs = 0;

    /**
     * Si es true, las peticiones de una misma sesión se procesan de una en una (FIFO).
     */
    private boolean serializePerSession = false;

    private int corePoolSize = 8;
    private int maxPoolSize = 64;
    private int queueCapacity = 200;

    public long getPacingMs() { return pacingMs; }
    public void setPacingMs(long pacingMs) { this.pacingMs = pacingMs; }

    public long getEmitterTimeoutMs() { return emitterTimeoutMs; }
    public void setEmitterTimeoutMs(long emitterTimeoutMs) { this.emitterTimeoutMs = emitterTimeoutMs; }

    public boolean isSerializePerSession() { return serializePerSession; }
    public void setSerializePerSession(boolean serializePerSession) { this.serializePerSession = serializePerSession; }

    public int getCorePoolSize() { return corePoolSize; }
    public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
}
