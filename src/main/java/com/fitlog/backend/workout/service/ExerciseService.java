package com.fitlog.backend.workout.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.DependencyConflictException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.workout.entity.Exercise;
import com.fitlog.backend.workout.repo.ExerciseLogRepo;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import com.fitlog.backend.workout.repo.WorkoutTypeRepo;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ExerciseService {

    private final ExerciseRepo exercises;
    private final WorkoutTypeRepo types;
    private final ExerciseLogRepo logs;
    private final EntityValidator validator;

    public ExerciseService(ExerciseRepo exercises, WorkoutTypeRepo types, ExerciseLogRepo logs,
                           EntityValidator validator) {
        this.exercises = exercises;
        this.types = types;
        this.logs = logs;
        this.validator = validator;
    }

    @Transactional
    public Exercise create(Exercise exercise) {
        exercise.setId(null);
        validator.validate(exercise);
        requireWorkoutType(exercise.getWorkoutTypeId());
        return EntityValidator.translate("exercise", () -> exercises.saveAndFlush(exercise));
    }

    @Transactional(readOnly = true)
    public Exercise get(Long id) {
        if (id == null) throw new NotFoundException("exercise", null);
        return exercises.findById(id).orElseThrow(() -> new NotFoundException("exercise", id));
    }

    @Transactional(readOnly = true)
    public List<Exercise> list() {
        return exercises.findAll(Sort.by("id"));
    }

    @Transactional(readOnly = true)
    public List<Exercise> listForWorkoutType(Long workoutTypeId) {
        return exercises.findByWorkoutTypeIdOrderByIdAsc(workoutTypeId);
    }

    @Transactional
    public Exercise update(Exercise changes) {
        Exercise row = get(changes.getId());

        row.setWorkoutTypeId(changes.getWorkoutTypeId());
        row.setExerciseName(changes.getExerciseName());
        row.setDescription(changes.getDescription());
        row.setEquipmentRequired(changes.getEquipmentRequired());
        row.setPrimaryMuscleGroup(changes.getPrimaryMuscleGroup());
        row.setDifficultyLevel(changes.getDifficultyLevel());
        row.setCaloriesBurnedPerMinute(changes.getCaloriesBurnedPerMinute());
        row.setMuscleGroupsSecondary(changes.getMuscleGroupsSecondary());
        row.setVideoTutorialLink(changes.getVideoTutorialLink());
        row.setImageUrl(changes.getImageUrl());

        validator.validate(row);
        requireWorkoutType(row.getWorkoutTypeId());
        row.markEdited();
        return EntityValidator.translate("exercise", () -> exercises.saveAndFlush(row));
    }

    /** Restricted while logs still reference the exercise, so history is never lost. */
    @Transactional
    public void delete(Long id) {
        Exercise row = get(id);
        long used = logs.countByExerciseId(id);
        if (used > 0) {
            throw new DependencyConflictException("exercise", id, "exercise_log", used);
        }
        EntityValidator.translateDelete("exercise", id, "exercise_log", () -> {
            exercises.delete(row);
            exercises.flush();
        });
    }

    private void requireWorkoutType(Long workoutTypeId) {
        if (!types.existsById(workoutTypeId)) {
            throw ConstraintViolationException.of("workoutTypeId", "WORKOUT_TYPE_NOT_FOUND");
        }
    }
}
