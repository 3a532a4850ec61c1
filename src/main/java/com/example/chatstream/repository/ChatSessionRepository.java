package com.example.chatstream.repository;

import com.example.chatstream.model.dto.SessionSummaryDto;
import com.example.chatstream.model.entity.ChatSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ChatSessionRepository extends JpaRepository<ChatSession, String> {

    Optional<ChatSession> findByIdAndUser_Id(String id, Long userId);

    boolean existsByIdAndUser_Id(String id, Long userId);

    @Query("""
        select new com.example.chatstream.model.dto.SessionSummaryDto(
            s.id,
            s.title,
            s.createdAt,
            count(m.id),
            max(m.createdAt)
        )
        from ChatSession s
        left join com.example.chatstream.model.entity.ChatMessage m
            on m.session = s
        where s.user.id = :userId
        group by s.id, s.title, s.createdAt
        order by s.createdAt desc
    """)
    List<SessionSummaryDto> listSummaries(@Param("userId") Long userId);
}
