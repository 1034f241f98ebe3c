package com.matchmate.backend.modules.match.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.matchmate.backend.modules.match.domain.UserMatch;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MatchRepository extends JpaRepository<UserMatch, UUID> {

    /**
     * Atomic insert-if-absent on the canonical pair.
     *
     * @return 1 when a row was inserted, 0 when the pair was already matched
     */
    @Modifying
    @Query(value = """
            insert into user_match (id, user_low_id, user_high_id, completed_by, created_at)
            values (:id, :lowId, :highId, :completedBy, :createdAt)
            on conflict (user_low_id, user_high_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("lowId") UUID lowId,
                       @Param("highId") UUID highId,
                       @Param("completedBy") UUID completedBy,
                       @Param("createdAt") OffsetDateTime createdAt);

    /**
     * Blocks until this transaction holds the advisory lock for the pair; released on commit or rollback.
     */
    @Query(value = "select count(*) from (select pg_advisory_xact_lock(:key)) pair_lock", nativeQuery = true)
    long lockPair(@Param("key") long key);

    boolean existsByUserLowIdAndUserHighId(UUID userLowId, UUID userHighId);

    long countByUserLowIdAndUserHighId(UUID userLowId, UUID userHighId);

    @Query("""
            select m
              from UserMatch m
             where m.userLowId = :userId
                or m.userHighId = :userId
             order by m.createdAt asc
            """)
    List<UserMatch> findAllInvolving(@Param("userId") UUID userId);
}
