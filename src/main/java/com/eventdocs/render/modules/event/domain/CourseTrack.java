package com.eventdocs.render.modules.event.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Relation of a course to one event track, including tracks in which the course is not offered at all.
 */
public class CourseTrack {

    private final Course course;
    private final EventTrack track;
    private final CourseTrackStatus status;
    private final List<CourseAttendee> attendees = new ArrayList<>();

    public CourseTrack(Course course, EventTrack track, CourseTrackStatus status) {
        this.course = course;
        this.track = track;
        this.status = status;
    }

    public Course getCourse() {
        return course;
    }

    public EventTrack getTrack() {
        return track;
    }

    public CourseTrackStatus getStatus() {
        return status;
    }

    /**
     * @return attendees in registration order, instructors included
     */
    public List<CourseAttendee> getAttendees() {
        return Collections.unmodifiableList(attendees);
    }

    public List<Registration> getInstructors() {
        return attendees.stream()
                .filter(CourseAttendee::instructor)
                .map(CourseAttendee::registration)
                .toList();
    }

    // Called while loading only; the graph is not changed once built.
    public void addAttendee(Registration registration, boolean instructor) {
        attendees.add(new CourseAttendee(registration, instructor));
    }
}
