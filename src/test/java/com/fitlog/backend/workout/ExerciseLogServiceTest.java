package com.fitlog.backend.workout;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.validation.EntityValidator;
import com.fitlog.backend.workout.entity.ExerciseLog;
import com.fitlog.backend.workout.repo.ExerciseLogRepo;
import com.fitlog.backend.workout.repo.ExerciseRepo;
import com.fitlog.backend.workout.repo.WorkoutSessionRepo;
import com.fitlog.backend.workout.service.ExerciseLogService;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExerciseLogServiceTest {

    ExerciseLogRepo logRepo;
    WorkoutSessionRepo sessionRepo;
    ExerciseRepo exerciseRepo;
    ExerciseLogService svc;

    @BeforeEach
    void setUp() {
        logRepo = mock(ExerciseLogRepo.class);
        sessionRepo = mock(WorkoutSessionRepo.class);
        exerciseRepo = mock(ExerciseRepo.class);
        EntityValidator validator = new EntityValidator(Validation.buildDefaultValidatorFactory().getValidator());
        svc = new ExerciseLogService(logRepo, sessionRepo, exerciseRepo, validator);
    }

    private static ExerciseLog entry(Long sessionId, Long exerciseId, Integer set) {
        ExerciseLog l = new ExerciseLog();
        l.setSessionId(sessionId);
        l.setExerciseId(exerciseId);
        l.setSetNumber(set);
        return l;
    }

    @Test
    void set_number_zero_is_rejected_before_any_lookup() {
        assertThatThrownBy(() -> svc.create(entry(1L, 2L, 0)))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(e -> assertThat(((ConstraintViolationException) e).fields()).containsKey("setNumber"));
        verifyNoInteractions(sessionRepo, exerciseRepo);
        verify(logRepo, never()).saveAndFlush(any());
    }

    @Test
    void dangling_session_is_constraint_violation() {
        when(sessionRepo.existsById(77L)).thenReturn(false);
        when(exerciseRepo.existsById(2L)).thenReturn(true);

        assertThatThrownBy(() -> svc.create(entry(77L, 2L, 1)))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(e -> assertThat(((ConstraintViolationException) e).fields())
                        .containsOnlyKeys("sessionId"));
    }

    @Test
    void both_references_dangling_are_reported_together() {
        when(sessionRepo.existsById(77L)).thenReturn(false);
        when(exerciseRepo.existsById(88L)).thenReturn(false);

        assertThatThrownBy(() -> svc.create(entry(77L, 88L, 1)))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(e -> assertThat(((ConstraintViolationException) e).fields())
                        .containsOnlyKeys("sessionId", "exerciseId"));
    }

    @Test
    void missing_foreign_keys_are_required_fields() {
        assertThatThrownBy(() -> svc.create(entry(null, null, 1)))
                .isInstanceOf(ConstraintViolationException.class)
                .satisfies(e -> assertThat(((ConstraintViolationException) e).fields())
                        .containsKeys("sessionId", "exerciseId"));
    }

    @Test
    void client_supplied_id_is_ignored_on_create() {
        when(sessionRepo.existsById(1L)).thenReturn(true);
        when(exerciseRepo.existsById(2L)).thenReturn(true);
        when(logRepo.saveAndFlush(any(ExerciseLog.class))).thenAnswer(inv -> inv.getArgument(0));

        ExerciseLog l = entry(1L, 2L, 1);
        l.setId(999L);

        assertThat(svc.create(l).getId()).isNull();
    }
}
