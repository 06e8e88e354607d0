package com.fitlog.backend.common.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * created_timestamp / last_edited_timestamp shared by every table.
 * Both are UTC instants truncated to microseconds so the value held in memory
 * is the one the database keeps.
 */
@Getter
@MappedSuperclass
public abstract class AuditedEntity {

    @Column(name = "created_timestamp", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_edited_timestamp", nullable = false)
    private Instant updatedAt;

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /** Forces last_edited_timestamp forward even when no other column changed. */
    public void markEdited() {
        Instant ts = now();
        if (updatedAt != null && !ts.isAfter(updatedAt)) {
            ts = updatedAt.plus(1, ChronoUnit.MICROS);
        }
        this.updatedAt = ts;
    }

    @PrePersist
    void onCreate() {
        Instant ts = now();
        this.createdAt = ts;
        this.updatedAt = ts;
    }

    @PreUpdate
    void onUpdate() {
        markEdited();
    }

    public abstract Long getId();
}
