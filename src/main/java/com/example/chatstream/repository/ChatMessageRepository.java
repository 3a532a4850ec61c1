package com.example.chatstream.repository;

import com.example.chatstream.model.entity.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    List<ChatMessage> findBySession_IdOrderByCreatedAtAscIdAsc(String sessionId);

    /**
     * Mensajes de la sesión anteriores a {@code beforeId}. El id es identity,
     * así que "anterior" sigue el orden de inserción aunque los timestamps coincidan.
     */
    @Query("""
        select m
        from ChatMessage m
        where m.session.id = :sessionId
          and m.id < :beforeId
        order by m.createdAt asc, m.id asc
    """)
    List<ChatMessage> findHistoryBefore(@Param("sessionId") String sessionId,
                                        @Param("beforeId") Long beforeId);

    long countBySession_Id(String sessionId);
}
