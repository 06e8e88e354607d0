package com.fitlog.backend.workout.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.workout.entity.ExerciseLog;
import com.fitlog.backend.workout.repo.ExerciseLogRepo;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import com.fitlog.backend.workout.repo.WorkoutSessionRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ExerciseLogService {

    private final ExerciseLogRepo logs;
    private final WorkoutSessionRepo sessions;
    private final ExerciseRepo exercises;
    private final EntityValidator validator;

    public ExerciseLogService(ExerciseLogRepo logs, WorkoutSessionRepo sessions, ExerciseRepo exercises,
                              EntityValidator validator) {
        this.logs = logs;
        this.sessions = sessions;
        this.exercises = exercises;
        this.validator = validator;
    }

    @Transactional
    public ExerciseLog create(ExerciseLog entry) {
        entry.setId(null);
        validator.validate(entry);
        requireReferences(entry);
        return EntityValidator.translate("exercise_log", () -> logs.saveAndFlush(entry));
    }

    @Transactional(readOnly = true)
    public ExerciseLog get(Long id) {
        if (id == null) throw new NotFoundException("exercise_log", null);
        return logs.findById(id).orElseThrow(() -> new NotFoundException("exercise_log", id));
    }

    @Transactional(readOnly = true)
    public List<ExerciseLog> listForSession(Long sessionId) {
        return logs.findSessionLogs(sessionId);
    }

    @Transactional(readOnly = true)
    public List<ExerciseLog> listForExercise(Long exerciseId) {
        return logs.findByExerciseIdOrderByIdAsc(exerciseId);
    }

    @Transactional
    public ExerciseLog update(ExerciseLog changes) {
        ExerciseLog row = get(changes.getId());

        row.setSessionId(changes.getSessionId());
        row.setExerciseId(changes.getExerciseId());
        row.setSetNumber(changes.getSetNumber());
        row.setRepetitions(changes.getRepetitions());
        row.setWeight(changes.getWeight());
        row.setDuration(changes.getDuration());
        row.setRestTime(changes.getRestTime());
        row.setNotes(changes.getNotes());
        row.setDifficultyLevel(changes.getDifficultyLevel());

        validator.validate(row);
        requireReferences(row);
        row.markEdited();
        return EntityValidator.translate("exercise_log", () -> logs.saveAndFlush(row));
    }

    /** Logs have no dependents. */
    @Transactional
    public void delete(Long id) {
        ExerciseLog row = get(id);
        logs.delete(row);
        logs.flush();
    }

    private void requireReferences(ExerciseLog entry) {
        Map<String, String> dangling = new LinkedHashMap<>();
        if (!sessions.existsById(entry.getSessionId())) dangling.put("sessionId", "WORKOUT_SESSION_NOT_FOUND");
        if (!exercises.existsById(entry.getExerciseId())) dangling.put("exerciseId", "EXERCISE_NOT_FOUND");
        if (!dangling.isEmpty()) throw new ConstraintViolationException(dangling);
    }
}
