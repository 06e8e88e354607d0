package com.fitlog.backend.workout.entity;

import com.fitlog.backend.common.entity.AuditedEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter @Setter @NoArgsConstructor
@ToString(exclude = "workoutType")
@Entity
@Table(name = "exercises", indexes = {
        @Index(name = "idx_exercises_workout_type", columnList = "workout_type_id")
})
public class Exercise extends AuditedEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "workout_type_id", nullable = false)
    private Long workoutTypeId;

    // read-only navigation; the FK column is written through workoutTypeId
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workout_type_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_exercises_workout_type"))
    private WorkoutType workoutType;

    @NotBlank
    @Column(name = "exercise_name", nullable = false, length = 120)
    private String exerciseName;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "equipment_required", length = 120)
    private String equipmentRequired;

    @Column(name = "primary_muscle_group", length = 64)
    private String primaryMuscleGroup;

    @Column(name = "difficulty_level", length = 32)
    private String difficultyLevel;

    @PositiveOrZero
    @Column(name = "calories_burned_per_minute")
    private Double caloriesBurnedPerMinute;

    /** free text, e.g. "Triceps, Shoulders" */
    @Column(name = "muscle_groups_secondary", length = 255)
    private String muscleGroupsSecondary;

    @Column(name = "video_tutorial_link", length = 512)
    private String videoTutorialLink;

    @Column(name = "image_url", length = 512)
    private String imageUrl;
}
