package com.fitlog.backend.workout.repo;

import com.fitlog.backend.workout.entity.WorkoutType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkoutTypeRepo extends JpaRepository<WorkoutType, Long> {

    List<WorkoutType> findAllByOrderByIdAsc();
}
