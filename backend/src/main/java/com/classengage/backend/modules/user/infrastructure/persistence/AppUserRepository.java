package com.classengage.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;

import com.classengage.backend.modules.user.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByDisplayName(String displayName);

    /**
     * Inserts the name unless another row already holds it.
     *
     * @return 1 when this call created the row, 0 when the name already existed
     */
    @Modifying
    @Query(value = """
            INSERT INTO users (display_name, created_at)
            VALUES (:displayName, :createdAt)
            ON CONFLICT (display_name) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("displayName") String displayName, @Param("createdAt") OffsetDateTime createdAt);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") Long id);
}
