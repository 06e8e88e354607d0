package com.fitlog.backend.workout.repo;

import com.fitlog.backend.workout.entity.WorkoutSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;

public interface WorkoutSessionRepo extends JpaRepository<WorkoutSession, Long> {

    @Query("""
        select ws from WorkoutSession ws
        where ws.userId = ?1
        order by ws.workoutDate desc, ws.id desc
        """)
    List<WorkoutSession> findUserSessions(Long userId);

    @Query("""
        select ws from WorkoutSession ws
        where ws.userId = ?1
          and ws.workoutDate between ?2 and ?3
        order by ws.workoutDate desc
        """)
    List<WorkoutSession> findUserSessionsBetween(Long userId, Instant start, Instant end);

    long countByUserId(Long userId);
}
