package com.fitlog.backend.workout.entity;

import com.fitlog.backend.common.entity.AuditedEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter @Setter @NoArgsConstructor
@ToString(exclude = {"session", "exercise"})
@Entity
@Table(name = "exercise_logs", indexes = {
        @Index(name = "idx_exercise_logs_session", columnList = "session_id"),
        @Index(name = "idx_exercise_logs_exercise", columnList = "exercise_id")
})
public class ExerciseLog extends AuditedEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_exercise_logs_session"))
    private WorkoutSession session;

    @NotNull
    @Column(name = "exercise_id", nullable = false)
    private Long exerciseId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "exercise_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_exercise_logs_exercise"))
    private Exercise exercise;

    @Min(1)
    @Column(name = "set_number")
    private Integer setNumber;

    @PositiveOrZero
    @Column(name = "repetitions")
    private Integer repetitions;

    @PositiveOrZero
    @Column(name = "weight")
    private Double weight;

    /** seconds */
    @PositiveOrZero
    @Column(name = "duration")
    private Integer duration;

    /** seconds */
    @PositiveOrZero
    @Column(name = "rest_time")
    private Integer restTime;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "difficulty_level", length = 32)
    private String difficultyLevel;
}
