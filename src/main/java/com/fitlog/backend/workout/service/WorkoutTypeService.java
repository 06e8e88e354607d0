package com.fitlog.backend.workout.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.DependencyConflictException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.workout.dto.FitnessDtos.WorkoutTypeFields;
import com.fitlog.backend.workout.entity.WorkoutType;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import com.fitlog.backend.workout.repo.WorkoutTypeRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class WorkoutTypeService {

    /** The example row inserted by {@link #seedDefaultWorkoutType()}. */
    public static final WorkoutTypeFields DEFAULT_SEED = new WorkoutTypeFields(
            "Strength Training",
            "Full Body",
            "Weightlifting",
            "A high-intensity workout for muscle building.",
            null
    );

    private final WorkoutTypeRepo types;
    private final ExerciseRepo exercises;
    private final EntityValidator validator;

    public WorkoutTypeService(WorkoutTypeRepo types, ExerciseRepo exercises, EntityValidator validator) {
        this.types = types;
        this.exercises = exercises;
        this.validator = validator;
    }

    @Transactional
    public WorkoutType create(WorkoutType type) {
        type.setId(null);
        validator.validate(type);
        return EntityValidator.translate("workout_type", () -> types.saveAndFlush(type));
    }

    @Transactional(readOnly = true)
    public WorkoutType get(Long id) {
        if (id == null) throw new NotFoundException("workout_type", null);
        return types.findById(id).orElseThrow(() -> new NotFoundException("workout_type", id));
    }

    @Transactional(readOnly = true)
    public List<WorkoutType> list() {
        return types.findAllByOrderByIdAsc();
    }

    @Transactional
    public WorkoutType update(WorkoutType changes) {
        WorkoutType row = get(changes.getId());

        row.setWorkoutName(changes.getWorkoutName());
        row.setMuscleGroupTargeted(changes.getMuscleGroupTargeted());
        row.setCategoryType(changes.getCategoryType());
        row.setDescription(changes.getDescription());
        row.setDifficultyLevel(changes.getDifficultyLevel());

        validator.validate(row);
        row.markEdited();
        return EntityValidator.translate("workout_type", () -> types.saveAndFlush(row));
    }

    /** Restricted while exercises are still filed under this type. */
    @Transactional
    public void delete(Long id) {
        WorkoutType row = get(id);
        long children = exercises.countByWorkoutTypeId(id);
        if (children > 0) {
            throw new DependencyConflictException("workout_type", id, "exercise", children);
        }
        EntityValidator.translateDelete("workout_type", id, "exercise", () -> {
            types.delete(row);
            types.flush();
        });
    }

    /**
     * Builds and stores one workout type from descriptive fields.
     * Not idempotent: calling twice stores two rows.
     */
    @Transactional
    public WorkoutType seedWorkoutType(WorkoutTypeFields fields) {
        if (fields == null) {
            throw ConstraintViolationException.of("fields", "WORKOUT_TYPE_FIELDS_REQUIRED");
        }
        WorkoutType t = new WorkoutType();
        t.setWorkoutName(fields.workoutName());
        t.setMuscleGroupTargeted(fields.muscleGroupTargeted());
        t.setCategoryType(fields.categoryType());
        t.setDescription(fields.description());
        t.setDifficultyLevel(fields.difficultyLevel());

        WorkoutType saved = create(t);
        log.info("[Seed] workout type id={} name={}", saved.getId(), saved.getWorkoutName());
        return saved;
    }

    @Transactional
    public WorkoutType seedDefaultWorkoutType() {
        return seedWorkoutType(DEFAULT_SEED);
    }
}
