package com.fitlog.backend.common.error;

import java.util.Locale;

public class NotFoundException extends FitnessDataException {

    private final String entity;
    private final Long id;

    public NotFoundException(String entity, Long id) {
        super(entity.toUpperCase(Locale.ROOT) + "_NOT_FOUND", entity + " " + id + " does not exist");
        this.entity = entity;
        this.id = id;
    }

    public String entity() { return entity; }
    public Long id() { return id; }
}
