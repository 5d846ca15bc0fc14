package com.classengage.backend.modules.session.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.classengage.backend.modules.session.domain.LiveSession;
import com.classengage.backend.modules.session.domain.SessionStatus;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LiveSessionRepository extends JpaRepository<LiveSession, Long> {

    @EntityGraph(attributePaths = "host")
    Optional<LiveSession> findByCode(String code);

    boolean existsByCode(String code);

    long countByHost_IdAndStatusIn(Long hostUserId, Collection<SessionStatus> statuses);

    @EntityGraph(attributePaths = "host")
    List<LiveSession> findByStatusInOrderByCreatedAtDescIdDesc(Collection<SessionStatus> statuses, Pageable pageable);
}
