package com.classengage.backend.modules.session.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

import com.classengage.backend.modules.session.domain.SessionParticipant;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface SessionParticipantRepository extends JpaRepository<SessionParticipant, Long> {

    /**
     * Inserts the roster entry, or overwrites the role when the user is already on the roster.
     * The first joined_at is kept on conflict.
     */
    @Modifying
    @Query(value = """
            INSERT INTO session_participants (session_id, user_id, role, joined_at)
            VALUES (:sessionId, :userId, :role, :joinedAt)
            ON CONFLICT (session_id, user_id) DO UPDATE SET role = EXCLUDED.role
            """, nativeQuery = true)
    int upsert(
            @Param("sessionId") Long sessionId,
            @Param("userId") Long userId,
            @Param("role") String role,
            @Param("joinedAt") OffsetDateTime joinedAt
    );

    @EntityGraph(attributePaths = "user")
    Optional<SessionParticipant> findBySession_IdAndUser_Id(Long sessionId, Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("""
            select p
              from SessionParticipant p
             where p.session.id = :sessionId
               and p.user.id = :userId
            """)
    Optional<SessionParticipant> findBySessionAndUserForUpdate(
            @Param("sessionId") Long sessionId,
            @Param("userId") Long userId
    );

    @Query("""
            select p
              from SessionParticipant p
              join fetch p.user u
             where p.session.id = :sessionId
             order by case when p.role = com.classengage.backend.modules.session.domain.ParticipantRole.HOST
                           then 0 else 1 end,
                      p.joinedAt asc,
                      p.id asc
            """)
    List<SessionParticipant> findRoster(@Param("sessionId") Long sessionId);

    long countBySession_Id(Long sessionId);
}
