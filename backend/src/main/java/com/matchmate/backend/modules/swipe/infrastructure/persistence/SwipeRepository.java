package com.matchmate.backend.modules.swipe.infrastructure.persistence;

import java.util.Set;
import java.util.UUID;

import com.matchmate.backend.modules.swipe.domain.Swipe;
import com.matchmate.backend.modules.swipe.domain.SwipeAction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SwipeRepository extends JpaRepository<Swipe, UUID> {

    boolean existsByActorIdAndTargetIdAndAction(UUID actorId, UUID targetId, SwipeAction action);

    @Query("select distinct s.targetId from Swipe s where s.actorId = :actorId")
    Set<UUID> findTargetIdsByActorId(@Param("actorId") UUID actorId);

    long countByActorIdAndTargetId(UUID actorId, UUID targetId);
}
