package com.matchmate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchmate.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user u
             where us.tokenHash = :tokenHash
               and us.expiresAt > :now
            """)
    Optional<UserSession> findActiveByTokenHash(@Param("tokenHash") String tokenHash,
                                                @Param("now") OffsetDateTime now);
}
