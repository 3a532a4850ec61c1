package com.example.chatstream.service.provider;

import java.util.Collection;
import java.util.TreeSet;

public class UnsupportedProviderException extends IllegalArgumentException {

    private final String providerId;

    public UnsupportedProviderException(String providerId, Collection<String> supported) {
        super("Proveedor no soportado: " + providerId + ". Disponibles: " + new TreeSet<>(supported));
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
