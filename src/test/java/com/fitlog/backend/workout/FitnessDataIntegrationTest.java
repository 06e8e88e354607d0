package com.fitlog.backend.workout;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.DependencyConflictException;
import com.fitlog.backend.common.error.NotFoundException;
import com.fitlog.backend.common.error.PreconditionException;
import com.fitlog.backend.testsupport.BaseSpringTest;
import com.fitlog.backend.users.user.entity.User;
import com.fitlog.backend.users.user.repo.UserRepo;
import com.fitlog.backend.users.user.service.UserService;
import com.fitlog.backend.workout.dto.FitnessDtos.ExerciseLogView;
import com.fitlog.backend.workout.dto.FitnessDtos.RecordedSessionView;
import com.fitlog.backend.workout.dto.FitnessDtos.WorkoutTypeFields;
import com.fitlog.backend.workout.entity.Exercise;
import com.fitlog.backend.workout.entity.ExerciseLog;
import com.fitlog.backend.workout.entity.WorkoutSession;
import com.fitlog.backend.workout.entity.WorkoutType;
import com.fitlog.backend.workout.repo.ExerciseLogRepo;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import com.fitlog.backend.workout.repo.WorkoutSessionRepo;
import com.fitlog.backend.workout.repo.WorkoutTypeRepo;
import com.fitlog.backend.workout.service.ExerciseLogService;
import com.fitlog.backend.workout.service.ExerciseService;
import com.fitlog.backend.workout.service.WorkoutRecordingService;
import com.fitlog.backend.workout.service.WorkoutSessionService;
import com.fitlog.backend.workout.service.WorkoutTypeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Services against H2. Not @Transactional on purpose: each call commits or
 * rolls back on its own, which is what the atomicity checks need.
 */
@SpringBootTest
class FitnessDataIntegrationTest extends BaseSpringTest {

    @Autowired UserService userService;
    @Autowired WorkoutTypeService workoutTypeService;
    @Autowired ExerciseService exerciseService;
    @Autowired WorkoutSessionService sessionService;
    @Autowired ExerciseLogService logService;
    @Autowired WorkoutRecordingService recording;

    @Autowired UserRepo userRepo;
    @Autowired WorkoutTypeRepo typeRepo;
    @Autowired ExerciseRepo exerciseRepo;
    @Autowired WorkoutSessionRepo sessionRepo;
    @Autowired ExerciseLogRepo logRepo;

    User user;
    WorkoutType strength;

    @BeforeEach
    void cleanAndSeed() {
        logRepo.deleteAllInBatch();
        sessionRepo.deleteAllInBatch();
        exerciseRepo.deleteAllInBatch();
        typeRepo.deleteAllInBatch();
        userRepo.deleteAllInBatch();

        user = userService.create(new User("lifter", "lifter@example.com", "bcrypt$x"));
        strength = workoutTypeService.seedDefaultWorkoutType();
    }

    private Exercise exercise(String name, String group) {
        Exercise e = new Exercise();
        e.setWorkoutTypeId(strength.getId());
        e.setExerciseName(name);
        e.setPrimaryMuscleGroup(group);
        return exerciseService.create(e);
    }

    @Test
    void create_assigns_key_and_equal_timestamps() {
        assertThat(user.getId()).isNotNull();
        assertThat(user.getCreatedAt()).isNotNull();
        assertThat(user.getUpdatedAt()).isNotNull();
        assertThat(user.getCreatedAt()).isBeforeOrEqualTo(user.getUpdatedAt());

        WorkoutType reloaded = workoutTypeService.get(strength.getId());
        assertThat(reloaded.getWorkoutName()).isEqualTo("Strength Training");
        assertThat(reloaded.getMuscleGroupTargeted()).isEqualTo("Full Body");
        assertThat(reloaded.getCategoryType()).isEqualTo("Weightlifting");
        assertThat(reloaded.getCreatedAt()).isEqualTo(strength.getCreatedAt());
    }

    @Test
    void update_moves_last_edited_forward_and_keeps_created() {
        Exercise bench = exercise("Bench Press", "Chest");
        Instant created = bench.getCreatedAt();
        Instant edited = bench.getUpdatedAt();

        bench.setEquipmentRequired("Barbell");
        Exercise updated = exerciseService.update(bench);

        assertThat(updated.getCreatedAt()).isEqualTo(created);
        assertThat(updated.getUpdatedAt()).isAfter(edited);

        Exercise reloaded = exerciseService.get(bench.getId());
        assertThat(reloaded.getEquipmentRequired()).isEqualTo("Barbell");
        assertThat(reloaded.getCreatedAt()).isEqualTo(created);
        assertThat(reloaded.getUpdatedAt()).isEqualTo(updated.getUpdatedAt());
    }

    @Test
    void update_of_missing_row_is_not_found() {
        WorkoutType ghost = new WorkoutType();
        ghost.setId(987654L);
        ghost.setWorkoutName("Ghost");
        ghost.setMuscleGroupTargeted("None");

        assertThatThrownBy(() -> workoutTypeService.update(ghost)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void exercise_with_dangling_workout_type_is_rejected() {
        Exercise e = new Exercise();
        e.setWorkoutTypeId(strength.getId() + 1000);
        e.setExerciseName("Orphan");

        assertThatThrownBy(() -> exerciseService.create(e))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("WORKOUT_TYPE_NOT_FOUND");
        assertThat(exerciseRepo.count()).isZero();
    }

    @Test
    void log_with_dangling_session_is_rejected() {
        Exercise squat = exercise("Squat", "Legs");
        ExerciseLog l = new ExerciseLog();
        l.setSessionId(555_555L);
        l.setExerciseId(squat.getId());
        l.setSetNumber(1);

        assertThatThrownBy(() -> logService.create(l))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(ex -> assertThat(((ConstraintViolationException) ex).fields()).containsKey("sessionId"));
    }

    @Test
    void record_three_exercises_writes_nine_logs_and_derives_duration() {
        Exercise squat = exercise("Squat", "Legs");
        Exercise row = exercise("Barbell Row", "Back");
        Exercise curl = exercise("Curl", "Biceps");

        RecordedSessionView rec = recording.recordWorkoutSession(
                user.getId(), List.of(squat.getId(), row.getId(), curl.getId()), 3);

        List<ExerciseLog> stored = logService.listForSession(rec.session().sessionId());
        assertThat(stored).hasSize(9);
        assertThat(stored).allSatisfy(l -> {
            assertThat(l.getSetNumber()).isBetween(1, 3);
            assertThat(l.getRepetitions()).isEqualTo(l.getSetNumber() == 3 ? 8 : 10);
        });
        assertThat(stored).filteredOn(l -> l.getExerciseId().equals(squat.getId()))
                .allMatch(l -> l.getWeight() == 50.0);
        assertThat(stored).filteredOn(l -> l.getExerciseId().equals(curl.getId()))
                .allMatch(l -> l.getWeight() == 25.0);

        WorkoutSession s = sessionService.get(rec.session().sessionId());
        assertThat(s.getUserId()).isEqualTo(user.getId());
        assertThat(s.getEndTime()).isAfterOrEqualTo(s.getStartTime());
        assertThat(s.getTotalDuration())
                .isEqualTo(WorkoutSessionService.durationMinutes(s.getStartTime(), s.getEndTime()));
        assertThat(rec.exerciseLogs()).extracting(ExerciseLogView::exerciseLogId).doesNotContainNull();
    }

    @Test
    void failure_midway_rolls_back_session_and_logs() {
        Exercise squat = exercise("Squat", "Legs");

        assertThatThrownBy(() -> recording.recordWorkoutSession(
                user.getId(), List.of(squat.getId(), squat.getId() + 999), 3))
                .isInstanceOf(ConstraintViolationException.class);

        assertThat(sessionRepo.count()).isZero();
        assertThat(logRepo.count()).isZero();
    }

    @Test
    void empty_exercise_list_fails_and_creates_nothing() {
        assertThatThrownBy(() -> recording.recordWorkoutSession(user.getId(), List.of()))
                .isInstanceOf(PreconditionException.class);

        assertThat(sessionRepo.count()).isZero();
        assertThat(logRepo.count()).isZero();
    }

    @Test
    void deleting_workout_type_with_exercises_is_restricted() {
        Exercise squat = exercise("Squat", "Legs");

        assertThatThrownBy(() -> workoutTypeService.delete(strength.getId()))
                .isInstanceOf(DependencyConflictException.class);

        assertThat(workoutTypeService.get(strength.getId())).isNotNull();
        assertThat(exerciseService.get(squat.getId())).isNotNull();
    }

    @Test
    void deleting_used_exercise_and_owning_user_is_restricted() {
        Exercise squat = exercise("Squat", "Legs");
        recording.recordWorkoutSession(user.getId(), List.of(squat.getId()));

        assertThatThrownBy(() -> exerciseService.delete(squat.getId()))
                .isInstanceOf(DependencyConflictException.class);
        assertThatThrownBy(() -> userService.delete(user.getId()))
                .isInstanceOf(DependencyConflictException.class);
    }

    @Test
    void deleting_session_cascades_to_its_logs_then_parents_can_go() {
        Exercise squat = exercise("Squat", "Legs");
        RecordedSessionView rec = recording.recordWorkoutSession(user.getId(), List.of(squat.getId()));

        sessionService.delete(rec.session().sessionId());

        assertThat(logRepo.count()).isZero();
        assertThatThrownBy(() -> sessionService.get(rec.session().sessionId()))
                .isInstanceOf(NotFoundException.class);

        exerciseService.delete(squat.getId());
        workoutTypeService.delete(strength.getId());
        userService.delete(user.getId());
        assertThat(userRepo.count()).isZero();
        assertThatThrownBy(() -> userService.delete(user.getId())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void seeding_twice_creates_two_rows() {
        workoutTypeService.seedDefaultWorkoutType();

        assertThat(workoutTypeService.list())
                .filteredOn(t -> t.getWorkoutName().equals("Strength Training"))
                .hasSize(2);
    }

    @Test
    void seeding_custom_fields_persists_difficulty_level() {
        WorkoutType yoga = workoutTypeService.seedWorkoutType(
                new WorkoutTypeFields("Yoga", "Core", "Flexibility", null, "Beginner"));

        WorkoutType reloaded = workoutTypeService.get(yoga.getId());
        assertThat(reloaded.getDifficultyLevel()).isEqualTo("Beginner");
        assertThat(reloaded.getCategoryType()).isEqualTo("Flexibility");
        assertThat(reloaded.getDescription()).isNull();
    }

    @Test
    void duplicate_email_is_rejected_case_insensitively() {
        assertThatThrownBy(() -> userService.create(new User("other", "LIFTER@example.com", "h")))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("EMAIL_TAKEN");
    }

    @Test
    void sessions_are_listed_per_user() {
        Exercise squat = exercise("Squat", "Legs");
        recording.recordWorkoutSession(user.getId(), List.of(squat.getId()));
        recording.recordSampleWorkout(user.getId());

        assertThat(sessionService.listForUser(user.getId())).hasSize(2);
        assertThat(logService.listForExercise(squat.getId())).hasSize(6);
        assertThat(exerciseService.listForWorkoutType(strength.getId())).hasSize(1);
        assertThat(exerciseService.list()).extracting(Exercise::getExerciseName).containsExactly("Squat");
        assertThat(sessionService.listForUserBetween(user.getId(),
                Instant.now().minusSeconds(3600), Instant.now().plusSeconds(3600))).hasSize(2);
        assertThat(userService.findByUsername(" lifter ")).map(User::getId).contains(user.getId());
    }
}
