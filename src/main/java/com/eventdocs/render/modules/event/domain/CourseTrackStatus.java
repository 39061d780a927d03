package com.eventdocs.render.modules.event.domain;

public enum CourseTrackStatus {
    NOT_OFFERED,
    CANCELLED,
    ACTIVE;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
