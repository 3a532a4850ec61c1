package com.example.chatstream.service;

public class ConversationStoreException extends RuntimeException {

    public ConversationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
