package com.fitlog.backend.workout.entity;

import com.fitlog.backend.common.entity.AuditedEntity;
import com.fitlog.backend.users.user.entity.User;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor
@ToString(exclude = "user")
@Entity
@Table(name = "workout_sessions", indexes = {
        @Index(name = "idx_workout_sessions_user_date", columnList = "user_id,workout_date")
})
public class WorkoutSession extends AuditedEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_workout_sessions_user"))
    private User user;

    /** Defaults to the insert time when left null. */
    @Column(name = "workout_date", nullable = false)
    private Instant workoutDate;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    /** whole minutes; derived from start/end when both are present */
    @PositiveOrZero
    @Column(name = "total_duration")
    private Integer totalDuration;

    @Column(name = "location", length = 120)
    private String location;

    @Column(name = "perceived_exertion")
    private Integer perceivedExertion;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "workout_source", length = 64)
    private String workoutSource;

    @PrePersist
    void defaultWorkoutDate() {
        if (workoutDate == null) workoutDate = AuditedEntity.now();
    }
}
