package com.example.chatstream.service.provider;

/**
 * Fallo de un proveedor (credenciales, cuota, red, respuesta ilegible).
 * El mensaje es apto para el cliente; el detalle técnico queda en la causa y en el log.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;

    public ProviderException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
