package com.eventdocs.render.modules.event.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Course assignment of a registration in one event track.
 */
public class RegistrationTrack {

    private final Registration registration;
    private final EventTrack track;
    private final Course course;
    private final Course offeredCourse;
    private final List<Course> choices;

    /**
     * @param choices ranked course choices; absent ranks are {@code null} entries
     */
    public RegistrationTrack(Registration registration, EventTrack track, Course course, Course offeredCourse,
                             List<Course> choices) {
        this.registration = registration;
        this.track = track;
        this.course = course;
        this.offeredCourse = offeredCourse;
        this.choices = Collections.unmodifiableList(new ArrayList<>(choices));
    }

    public static RegistrationTrack empty(Registration registration, EventTrack track) {
        return new RegistrationTrack(registration, track, null, null,
                Collections.nCopies(track.getNumChoices(), null));
    }

    public Registration getRegistration() {
        return registration;
    }

    public EventTrack getTrack() {
        return track;
    }

    public RegistrationPart getRegistrationPart() {
        return registration.getPart(track.getPart());
    }

    /**
     * @return the assigned course, or {@code null}
     */
    public Course getCourse() {
        return course;
    }

    /**
     * @return the course this registration instructs in this track, or {@code null}
     */
    public Course getOfferedCourse() {
        return offeredCourse;
    }

    public List<Course> getChoices() {
        return choices;
    }

    public boolean isInstructor() {
        return offeredCourse != null && offeredCourse == course;
    }
}
