package com.example.chatstream.model.dto;

/**
 * Título opcional; vacío o ausente deja el título por defecto.
 */
public class SessionCreateRequest {

    private String title;

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
}
