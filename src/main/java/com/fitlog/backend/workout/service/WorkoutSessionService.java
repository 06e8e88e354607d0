package com.fitlog.backend.workout.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.users.user.repo.UserRepo;
import com.fitlog.backend.workout.entity.WorkoutSession;
import com.fitlog.backend.workout.repo.ExerciseLogRepo;
import com.fitlog.backend.workout.repo.WorkoutSessionRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class WorkoutSessionService {

    private final WorkoutSessionRepo sessions;
    private final UserRepo users;
    private final ExerciseLogRepo logs;
    private final EntityValidator validator;

    public WorkoutSessionService(WorkoutSessionRepo sessions, UserRepo users, ExerciseLogRepo logs,
                                 EntityValidator validator) {
        this.sessions = sessions;
        this.users = users;
        this.logs = logs;
        this.validator = validator;
    }

    /** Whole minutes between start and end, rounded down. */
    public static int durationMinutes(Instant start, Instant end) {
        try {
            return Math.toIntExact(Duration.between(start, end).toMinutes());
        } catch (ArithmeticException ex) {
            throw new ConstraintViolationException(Map.of("endTime", "DURATION_OUT_OF_RANGE"), ex);
        }
    }

    @Transactional
    public WorkoutSession create(WorkoutSession session) {
        session.setId(null);
        prepare(session);
        return EntityValidator.translate("workout_session", () -> sessions.saveAndFlush(session));
    }

    @Transactional(readOnly = true)
    public WorkoutSession get(Long id) {
        if (id == null) throw new NotFoundException("workout_session", null);
        return sessions.findById(id).orElseThrow(() -> new NotFoundException("workout_session", id));
    }

    @Transactional(readOnly = true)
    public List<WorkoutSession> listForUser(Long userId) {
        return sessions.findUserSessions(userId);
    }

    @Transactional(readOnly = true)
    public List<WorkoutSession> listForUserBetween(Long userId, Instant start, Instant end) {
        return sessions.findUserSessionsBetween(userId, start, end);
    }

    @Transactional
    public WorkoutSession update(WorkoutSession changes) {
        WorkoutSession row = get(changes.getId());

        row.setUserId(changes.getUserId());
        row.setWorkoutDate(changes.getWorkoutDate() != null ? changes.getWorkoutDate() : row.getWorkoutDate());
        row.setStartTime(changes.getStartTime());
        row.setEndTime(changes.getEndTime());
        row.setTotalDuration(changes.getTotalDuration());
        row.setLocation(changes.getLocation());
        row.setPerceivedExertion(changes.getPerceivedExertion());
        row.setNotes(changes.getNotes());
        row.setWorkoutSource(changes.getWorkoutSource());

        prepare(row);
        row.markEdited();
        return EntityValidator.translate("workout_session", () -> sessions.saveAndFlush(row));
    }

    /** Logs belong to their session and go with it. */
    @Transactional
    public void delete(Long id) {
        WorkoutSession row = get(id);
        int removed = logs.deleteBySessionId(id);
        EntityValidator.translateDelete("workout_session", id, "exercise_log", () -> {
            sessions.delete(row);
            sessions.flush();
        });
        log.info("workout session deleted id={} logsRemoved={}", id, removed);
    }

    private void prepare(WorkoutSession s) {
        validator.validate(s);
        if (!users.existsById(s.getUserId())) {
            throw ConstraintViolationException.of("userId", "USER_NOT_FOUND");
        }
        if (s.getStartTime() != null && s.getEndTime() != null) {
            if (s.getEndTime().isBefore(s.getStartTime())) {
                throw ConstraintViolationException.of("endTime", "END_BEFORE_START");
            }
            s.setTotalDuration(durationMinutes(s.getStartTime(), s.getEndTime()));
        }
    }
}
