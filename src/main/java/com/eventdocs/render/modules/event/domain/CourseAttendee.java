package com.eventdocs.render.modules.event.domain;

public record CourseAttendee(Registration registration, boolean instructor) {
}
