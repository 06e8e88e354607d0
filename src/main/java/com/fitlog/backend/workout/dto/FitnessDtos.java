package com.fitlog.backend.workout.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fitlog.backend.users.user.entity.User;
import com.fitlog.backend.workout.entity.Exercise;
import com.fitlog.backend.workout.entity.ExerciseLog;
import com.fitlog.backend.workout.entity.WorkoutSession;
import com.fitlog.backend.workout.entity.WorkoutType;

import java.time.Instant;
import java.util.List;

/**
 * Serialized shapes of the five tables.
 * Every view lists its columns explicitly; nothing is reflected off the entity,
 * so bookkeeping fields and secrets (password_hash) never leak out.
 */
public class FitnessDtos {

    /** Descriptive input of {@code seedWorkoutType}. */
    public record WorkoutTypeFields(
            String workoutName,
            String muscleGroupTargeted,
            String categoryType,
            String description,
            String difficultyLevel
    ) {}

    /** Optional descriptive columns for a recorded session. */
    public record SessionDetails(
            String location,
            Integer perceivedExertion,
            String notes,
            String workoutSource
    ) {
        public static final SessionDetails NONE = new SessionDetails(null, null, null, null);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record UserView(
            Long userId,
            String username,
            String email,
            String firstName,
            String lastName,
            Instant createdTimestamp,
            Instant lastEditedTimestamp
    ) {
        public static UserView from(User u) {
            return new UserView(u.getId(), u.getUsername(), u.getEmail(),
                    u.getFirstName(), u.getLastName(), u.getCreatedAt(), u.getUpdatedAt());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record WorkoutTypeView(
            Long workoutTypeId,
            String workoutName,
            String muscleGroupTargeted,
            String categoryType,
            String description,
            String difficultyLevel,
            Instant createdTimestamp,
            Instant lastEditedTimestamp
    ) {
        public static WorkoutTypeView from(WorkoutType t) {
            return new WorkoutTypeView(t.getId(), t.getWorkoutName(), t.getMuscleGroupTargeted(),
                    t.getCategoryType(), t.getDescription(), t.getDifficultyLevel(),
                    t.getCreatedAt(), t.getUpdatedAt());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExerciseView(
            Long exerciseId,
            Long workoutTypeId,
            String exerciseName,
            String description,
            String equipmentRequired,
            String primaryMuscleGroup,
            String difficultyLevel,
            Double caloriesBurnedPerMinute,
            String muscleGroupsSecondary,
            String videoTutorialLink,
            String imageUrl,
            Instant createdTimestamp,
            Instant lastEditedTimestamp
    ) {
        public static ExerciseView from(Exercise e) {
            return new ExerciseView(e.getId(), e.getWorkoutTypeId(), e.getExerciseName(), e.getDescription(),
                    e.getEquipmentRequired(), e.getPrimaryMuscleGroup(), e.getDifficultyLevel(),
                    e.getCaloriesBurnedPerMinute(), e.getMuscleGroupsSecondary(),
                    e.getVideoTutorialLink(), e.getImageUrl(), e.getCreatedAt(), e.getUpdatedAt());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record WorkoutSessionView(
            Long sessionId,
            Long userId,
            Instant workoutDate,
            Instant startTime,
            Instant endTime,
            Integer totalDuration,
            String location,
            Integer perceivedExertion,
            String notes,
            String workoutSource,
            Instant createdTimestamp,
            Instant lastEditedTimestamp
    ) {
        public static WorkoutSessionView from(WorkoutSession s) {
            return new WorkoutSessionView(s.getId(), s.getUserId(), s.getWorkoutDate(),
                    s.getStartTime(), s.getEndTime(), s.getTotalDuration(), s.getLocation(),
                    s.getPerceivedExertion(), s.getNotes(), s.getWorkoutSource(),
                    s.getCreatedAt(), s.getUpdatedAt());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExerciseLogView(
            Long exerciseLogId,
            Long sessionId,
            Long exerciseId,
            Integer setNumber,
            Integer repetitions,
            Double weight,
            Integer duration,
            Integer restTime,
            String notes,
            String difficultyLevel,
            Instant createdTimestamp,
            Instant lastEditedTimestamp
    ) {
        public static ExerciseLogView from(ExerciseLog l) {
            return new ExerciseLogView(l.getId(), l.getSessionId(), l.getExerciseId(), l.getSetNumber(),
                    l.getRepetitions(), l.getWeight(), l.getDuration(), l.getRestTime(), l.getNotes(),
                    l.getDifficultyLevel(), l.getCreatedAt(), l.getUpdatedAt());
        }
    }

    /** A session together with the logs written for it. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RecordedSessionView(
            WorkoutSessionView session,
            List<ExerciseLogView> exerciseLogs
    ) {}
}
