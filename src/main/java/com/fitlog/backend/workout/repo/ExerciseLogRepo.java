package com.fitlog.backend.workout.repo;

import com.fitlog.backend.workout.entity.ExerciseLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ExerciseLogRepo extends JpaRepository<ExerciseLog, Long> {

    @Query("""
        select l from ExerciseLog l
        where l.sessionId = :sid
        order by l.exerciseId asc, l.setNumber asc, l.id asc
        """)
    List<ExerciseLog> findSessionLogs(@Param("sid") Long sessionId);

    List<ExerciseLog> findByExerciseIdOrderByIdAsc(Long exerciseId);

    long countByExerciseId(Long exerciseId);

    long countBySessionId(Long sessionId);

    @Modifying
    @Query("delete from ExerciseLog l where l.sessionId = :sid")
    int deleteBySessionId(@Param("sid") Long sessionId);
}
