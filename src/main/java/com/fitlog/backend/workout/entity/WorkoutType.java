package com.fitlog.backend.workout.entity;

import com.fitlog.backend.common.entity.AuditedEntity;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter @Setter @NoArgsConstructor @ToString
@Entity
@Table(name = "workout_types")
public class WorkoutType extends AuditedEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "workout_name", nullable = false, length = 120)
    private String workoutName;

    @NotBlank
    @Column(name = "muscle_group_targeted", nullable = false, length = 120)
    private String muscleGroupTargeted;

    @Column(name = "category_type", length = 64)
    private String categoryType;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "difficulty_level", length = 32)
    private String difficultyLevel;
}
