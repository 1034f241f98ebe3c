package com.matchmate.backend.modules.swipe.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * One directional like/pass decision. Rows are append-only; the same pair may appear many times.
 */
@Entity
@Immutable
@Table(name = "swipe")
public class Swipe {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "actor_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID actorId;

    @Column(name = "target_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 8)
    private SwipeAction action;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected Swipe() {
    }

    public Swipe(UUID actorId, UUID targetId, SwipeAction action, OffsetDateTime createdAt) {
        this.actorId = actorId;
        this.targetId = targetId;
        this.action = action;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getActorId() {
        return actorId;
    }

    public UUID getTargetId() {
        return targetId;
    }

    public SwipeAction getAction() {
        return action;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
