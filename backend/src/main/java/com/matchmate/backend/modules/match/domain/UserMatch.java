package com.matchmate.backend.modules.match.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Confirmed mutual like. Rows are written through {@code MatchRepository#insertIfAbsent}.
 */
@Entity
@Immutable
@Table(name = "user_match")
public class UserMatch {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_low_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userLowId;

    @Column(name = "user_high_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userHighId;

    // actor whose like completed the pair
    @Column(name = "completed_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID completedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected UserMatch() {
    }

    public UserMatch(UUID id, MatchPair pair, UUID completedBy, OffsetDateTime createdAt) {
        this.id = id;
        this.userLowId = pair.low();
        this.userHighId = pair.high();
        this.completedBy = completedBy;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public MatchPair getPair() {
        return new MatchPair(userLowId, userHighId);
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
