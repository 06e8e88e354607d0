package com.fitlog.backend.common.validation;

import com.fitlog.backend.common.error.ConstraintViolationException;
import com.fitlog.backend.common.error.DependencyConflictException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs Bean Validation on an entity before it reaches the database and
 * reports every failing field at once.
 */
@Component
public class EntityValidator {

    private final Validator validator;

    public EntityValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> void validate(T entity) {
        Set<ConstraintViolation<T>> violations = validator.validate(entity);
        if (violations.isEmpty()) return;

        Map<String, String> fields = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> fields.putIfAbsent(v.getPropertyPath().toString(), v.getMessage()));
        throw new ConstraintViolationException(fields);
    }

    /**
     * Database-side unique / FK failures (typically a race between the
     * existence check and the flush) surface as the same taxonomy.
     */
    public static <T> T translate(String entity, Supplier<T> write) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException ex) {
            String detail = ex.getMostSpecificCause().getMessage();
            throw new ConstraintViolationException(
                    Map.of(entity, detail == null ? "DATA_INTEGRITY_VIOLATION" : detail), ex);
        }
    }

    /**
     * A dependent row inserted after the restrict check fails the delete on
     * flush; report it as the same conflict the check would have raised.
     */
    public static void translateDelete(String entity, Long id, String dependent, Runnable delete) {
        try {
            delete.run();
        } catch (DataIntegrityViolationException ex) {
            throw new DependencyConflictException(entity, id, dependent, ex);
        }
    }
}
