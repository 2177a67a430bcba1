package com.adautopilot.common.exception;

public class NotFoundException extends AutopilotException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, String id) {
        super(entity + " " + id + " not found");
        this.entity = entity;
        this.id     = id;
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}
