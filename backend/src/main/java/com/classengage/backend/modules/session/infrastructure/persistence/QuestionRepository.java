package com.classengage.backend.modules.session.infrastructure.persistence;

import java.util.List;

import com.classengage.backend.modules.session.domain.Question;
import com.classengage.backend.modules.session.domain.QuestionStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface QuestionRepository extends JpaRepository<Question, Long> {

    long countBySession_IdAndAuthor_IdAndStatus(Long sessionId, Long authorUserId, QuestionStatus status);

    @Query("""
            select q
              from Question q
              left join fetch q.author a
             where q.session.id = :sessionId
             order by q.createdAt desc,
                      q.id desc
            """)
    List<Question> findBySessionNewestFirst(@Param("sessionId") Long sessionId);

    @Query("""
            select q
              from Question q
              left join fetch q.author a
             where q.session.id = :sessionId
               and q.status = :status
             order by q.createdAt desc,
                      q.id desc
            """)
    List<Question> findBySessionAndStatusNewestFirst(
            @Param("sessionId") Long sessionId,
            @Param("status") QuestionStatus status
    );
}
