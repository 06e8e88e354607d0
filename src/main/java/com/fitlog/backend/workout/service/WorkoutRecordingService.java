package com.fitlog.backend.workout.service;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.PreconditionException;
import com.fitlog.backend.users.user.repo.UserRepo;
import com.fitlog.backend.workout.dto.FitnessDtos.ExerciseLogView;
import com.fitlog.backend.workout.dto.FitnessDtos.RecordedSessionView;
import com.fitlog.backend.workout.dto.FitnessDtos.SessionDetails;
import com.fitlog.backend.workout.dto.FitnessDtos.WorkoutSessionView;
import com.fitlog.backend.workout.entity.Exercise;
import com.fitlog.backend.workout.entity.ExerciseLog;
import com.fitlog.backend.workout.entity.WorkoutSession;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes a whole workout (session row plus one log per set) as one unit.
 * Any failure rolls back the session and every log staged before it.
 */
@Slf4j
@Service
public class WorkoutRecordingService {

    public static final int DEFAULT_SETS_PER_EXERCISE = 3;
    public static final int REPS_PER_SET = 10;
    public static final int REPS_LAST_SET = 8;
    public static final double HEAVY_WEIGHT = 50.0;
    public static final double LIGHT_WEIGHT = 25.0;
    public static final int REST_SECONDS = 60;
    public static final String SET_DIFFICULTY = "Medium";

    /** large muscle groups get the heavier default load */
    static final Set<String> HEAVY_GROUPS = Set.of("Chest", "Back", "Legs");

    /** Details used by the sample workout. */
    public static final SessionDetails SAMPLE_DETAILS =
            new SessionDetails("Home Gym", 7, "Felt strong today", null);
    static final int SAMPLE_EXERCISE_LIMIT = 3;

    private final UserRepo users;
    private final ExerciseRepo exercises;
    private final WorkoutSessionService sessions;
    private final ExerciseLogService logs;
    private final Clock clock;

    public WorkoutRecordingService(UserRepo users, ExerciseRepo exercises, WorkoutSessionService sessions,
                                   ExerciseLogService logs, Clock clock) {
        this.users = users;
        this.exercises = exercises;
        this.sessions = sessions;
        this.logs = logs;
        this.clock = clock;
    }

    @Transactional
    public RecordedSessionView recordWorkoutSession(Long userId, List<Long> exerciseIds) {
        return recordWorkoutSession(userId, exerciseIds, DEFAULT_SETS_PER_EXERCISE, SessionDetails.NONE);
    }

    @Transactional
    public RecordedSessionView recordWorkoutSession(Long userId, List<Long> exerciseIds, int setsPerExercise) {
        return recordWorkoutSession(userId, exerciseIds, setsPerExercise, SessionDetails.NONE);
    }

    @Transactional
    public RecordedSessionView recordWorkoutSession(Long userId, List<Long> exerciseIds, int setsPerExercise,
                                                    SessionDetails details) {
        if (userId == null || !users.existsById(userId)) {
            throw new PreconditionException("USER_NOT_FOUND");
        }
        if (exerciseIds == null || exerciseIds.isEmpty()) {
            throw new PreconditionException("EXERCISES_REQUIRED");
        }
        if (setsPerExercise < 1) {
            throw new PreconditionException("SETS_PER_EXERCISE_MIN_1");
        }
        SessionDetails d = (details == null) ? SessionDetails.NONE : details;

        Instant start = now();
        WorkoutSession ws = new WorkoutSession();
        ws.setUserId(userId);
        ws.setWorkoutDate(start);
        ws.setStartTime(start);
        ws.setLocation(d.location());
        ws.setPerceivedExertion(d.perceivedExertion());
        ws.setNotes(d.notes());
        ws.setWorkoutSource(d.workoutSource());
        ws = sessions.create(ws);

        List<ExerciseLogView> written = new ArrayList<>(exerciseIds.size() * setsPerExercise);
        for (Long exerciseId : exerciseIds) {
            // an unknown id aborts the whole workout, including the session row above
            Exercise ex = Optional.ofNullable(exerciseId)
                    .flatMap(exercises::findById)
                    .orElseThrow(() -> ConstraintViolationException.of("exerciseId", "EXERCISE_NOT_FOUND"));
            double weight = weightFor(ex);

            for (int set = 1; set <= setsPerExercise; set++) {
                ExerciseLog entry = new ExerciseLog();
                entry.setSessionId(ws.getId());
                entry.setExerciseId(ex.getId());
                entry.setSetNumber(set);
                entry.setRepetitions(set < setsPerExercise ? REPS_PER_SET : REPS_LAST_SET);
                entry.setWeight(weight);
                entry.setRestTime(REST_SECONDS);
                entry.setDifficultyLevel(SET_DIFFICULTY);
                written.add(ExerciseLogView.from(logs.create(entry)));
            }
        }

        ws.setEndTime(now());
        ws = sessions.update(ws);

        log.info("workout recorded sessionId={} userId={} exercises={} logs={} minutes={}",
                ws.getId(), userId, exerciseIds.size(), written.size(), ws.getTotalDuration());
        return new RecordedSessionView(WorkoutSessionView.from(ws), written);
    }

    /**
     * The sample workout: first three stored exercises, three sets each.
     * An empty exercise table is a precondition failure, not a silent no-op.
     */
    @Transactional
    public RecordedSessionView recordSampleWorkout(Long userId) {
        List<Long> ids = exercises.findFirstExercises(PageRequest.of(0, SAMPLE_EXERCISE_LIMIT))
                .stream()
                .map(Exercise::getId)
                .toList();
        if (ids.isEmpty()) {
            log.warn("sample workout skipped for userId={}: no exercises stored", userId);
            throw new PreconditionException("EXERCISES_REQUIRED");
        }
        return recordWorkoutSession(userId, ids, DEFAULT_SETS_PER_EXERCISE, SAMPLE_DETAILS);
    }

    static double weightFor(Exercise ex) {
        String group = ex.getPrimaryMuscleGroup();
        return (group != null && HEAVY_GROUPS.contains(group)) ? HEAVY_WEIGHT : LIGHT_WEIGHT;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
