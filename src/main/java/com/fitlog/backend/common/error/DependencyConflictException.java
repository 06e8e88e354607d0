package com.fitlog.backend.common.error;

/**
 * Delete refused because other rows still point at the target.
 */
public class DependencyConflictException extends FitnessDataException {

    public static final String CODE = "DEPENDENCY_CONFLICT";

    private final String entity;
    private final Long id;
    private final String dependent;
    private final long dependentCount;

    public DependencyConflictException(String entity, Long id, String dependent, long dependentCount) {
        super(CODE, entity + " " + id + " is still referenced by " + dependentCount + " " + dependent + " row(s)");
        this.entity = entity;
        this.id = id;
        this.dependent = dependent;
        this.dependentCount = dependentCount;
    }

    /** Conflict reported by the database on flush; the dependent count is unknown ({@code -1}). */
    public DependencyConflictException(String entity, Long id, String dependent, Throwable cause) {
        super(CODE, entity + " " + id + " is still referenced by " + dependent + " row(s)", cause);
        this.entity = entity;
        this.id = id;
        this.dependent = dependent;
        this.dependentCount = -1;
    }

    public String entity() { return entity; }
    public Long id() { return id; }
    public String dependent() { return dependent; }
    public long dependentCount() { return dependentCount; }
}
