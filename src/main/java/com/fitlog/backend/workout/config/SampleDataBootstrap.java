package com.fitlog.backend.workout.config;

import com.fitlog.backend.common.error.FitnessDataException;
import com.fitlog.backend.workout.dto.FitnessDtos.RecordedSessionView;
import com.fitlog.backend.workout.entity.WorkoutType;
import com.fitlog.backend.workout.service.WorkoutRecordingService;
import com.fitlog.backend.workout.service.WorkoutTypeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Start-up hook for the two example inserts: one workout type and one
 * recorded workout. Off unless app.sample-data.enabled=true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SampleDataBootstrap implements ApplicationRunner {

    private final SampleDataProperties props;
    private final WorkoutTypeService workoutTypes;
    private final WorkoutRecordingService recording;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isEnabled()) return;

        if (props.isSeedWorkoutType()) {
            WorkoutType t = workoutTypes.seedDefaultWorkoutType();
            log.info("[SampleData] seeded workout type id={}", t.getId());
        }

        Long uid = props.getUserId();
        if (uid == null) return;
        try {
            RecordedSessionView rec = recording.recordSampleWorkout(uid);
            log.info("[SampleData] recorded session id={} with {} logs",
                    rec.session().sessionId(), rec.exerciseLogs().size());
        } catch (FitnessDataException e) {
            // start-up continues; the rejection is logged with its code
            log.warn("[SampleData] sample workout rejected: code={} msg={}", e.code(), e.getMessage());
        }
    }
}
