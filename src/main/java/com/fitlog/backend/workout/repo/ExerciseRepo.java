package com.fitlog.backend.workout.repo;

import com.fitlog.backend.workout.entity.Exercise;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ExerciseRepo extends JpaRepository<Exercise, Long> {

    List<Exercise> findByWorkoutTypeIdOrderByIdAsc(Long workoutTypeId);

    long countByWorkoutTypeId(Long workoutTypeId);

    @Query("""
        select e from Exercise e
        order by e.id asc
        """)
    List<Exercise> findFirstExercises(Pageable page);
}
