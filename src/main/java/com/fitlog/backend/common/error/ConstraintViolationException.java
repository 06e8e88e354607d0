package com.fitlog.backend.common.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Missing required field, dangling foreign key or failed check (e.g. set_number &lt; 1).
 */
public class ConstraintViolationException extends FitnessDataException {

    public static final String CODE = "CONSTRAINT_VIOLATION";

    private final Map<String, String> fields;

    public ConstraintViolationException(Map<String, String> fields) {
        super(CODE, describe(fields));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public ConstraintViolationException(Map<String, String> fields, Throwable cause) {
        super(CODE, describe(fields), cause);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ConstraintViolationException of(String field, String message) {
        return new ConstraintViolationException(Map.of(field, message));
    }

    /** field -> first message reported for it */
    public Map<String, String> fields() { return fields; }

    private static String describe(Map<String, String> fields) {
        StringBuilder sb = new StringBuilder(CODE);
        fields.forEach((k, v) -> sb.append(' ').append(k).append(": ").append(v).append(';'));
        return sb.toString();
    }
}
