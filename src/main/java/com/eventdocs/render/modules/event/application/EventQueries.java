package com.eventdocs.render.modules.event.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.CourseAttendee;
import com.eventdocs.render.modules.event.domain.CourseTrack;
import com.eventdocs.render.modules.event.domain.Event;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.event.domain.RegistrationPartStatus;
import com.eventdocs.render.modules.event.domain.RegistrationTrack;

/**
 * Read-only queries over a loaded {@link Event}, used by the rendering side.
 */
public final class EventQueries {

    private EventQueries() {
    }

    /**
     * A course participant with the tracks in which they attend the course.
     */
    public record CourseParticipation(Registration registration, List<EventTrack> tracks) {
    }

    /**
     * Courses to print on a nametag; {@code merged} is set if both tracks share one course.
     */
    public record NametagCourses(List<Course> courses, boolean merged) {
    }

    /**
     * Registrations with one of the given statuses in at least one of the given parts, in registration order.
     *
     * @param parts the parts to check, {@code null} for all parts of the event
     */
    public static List<Registration> registrationsWithStatus(Event event, Set<RegistrationPartStatus> statuses,
                                                             Collection<EventPart> parts) {
        Collection<EventPart> checkedParts = parts != null ? parts : event.getParts();
        return event.getRegistrations().stream()
                .filter(registration -> checkedParts.stream()
                        .anyMatch(part -> statuses.contains(registration.getPart(part).getStatus())))
                .toList();
    }

    /**
     * Participants (and optionally guests) of the given parts, optionally restricted to list consent or minors.
     *
     * @param parts the parts to check, {@code null} for all parts of the event
     */
    public static List<Registration> activeRegistrations(Event event, Collection<EventPart> parts,
                                                         boolean includeGuests, boolean listConsentOnly,
                                                         boolean minorsOnly) {
        Set<RegistrationPartStatus> statuses = includeGuests
                ? EnumSet.of(RegistrationPartStatus.PARTICIPANT, RegistrationPartStatus.GUEST)
                : EnumSet.of(RegistrationPartStatus.PARTICIPANT);
        return registrationsWithStatus(event, statuses, parts).stream()
                .filter(registration -> !listConsentOnly || registration.isListConsent())
                .filter(registration -> !minorsOnly || registration.isMinor())
                .toList();
    }

    public static List<EventTrack> tracksOfParts(Event event, Collection<EventPart> parts) {
        return event.getTracks().stream()
                .filter(track -> parts.contains(track.getPart()))
                .toList();
    }

    /**
     * Regular participants of a course across all its active tracks. Instructors, guests and registrations that are
     * not participants of the track's part are left out.
     */
    public static List<CourseParticipation> gatherCourseAttendees(Course course) {
        Map<Registration, List<EventTrack>> attendees = new LinkedHashMap<>();
        for (CourseTrack courseTrack : course.getCourseTracks()) {
            if (!courseTrack.getStatus().isActive()) {
                continue;
            }
            EventTrack track = courseTrack.getTrack();
            for (CourseAttendee attendee : courseTrack.getAttendees()) {
                Registration registration = attendee.registration();
                if (attendee.instructor()
                        || registration.getTrack(track).getRegistrationPart().getStatus()
                            != RegistrationPartStatus.PARTICIPANT) {
                    continue;
                }
                attendees.computeIfAbsent(registration, key -> new ArrayList<>()).add(track);
            }
        }
        return attendees.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(EventOrdering.REGISTRATIONS))
                .map(entry -> new CourseParticipation(entry.getKey(), List.copyOf(entry.getValue())))
                .toList();
    }

    /**
     * Courses of a registration for its nametag, one entry per track the registration is present in.
     *
     * @param merge collapse the first two entries if they are the same course
     * @param secondAlwaysRight add a {@code null} entry for tracks the registration is not present in, so a course of
     *                          the second track stays on the right side
     */
    public static NametagCourses nametagCourses(Registration registration, List<EventTrack> tracks, boolean merge,
                                                boolean secondAlwaysRight) {
        List<Course> courses = new ArrayList<>();
        for (EventTrack track : tracks) {
            RegistrationTrack registrationTrack = registration.getTrack(track);
            if (registrationTrack.getRegistrationPart().getStatus().isPresent()) {
                courses.add(registrationTrack.getCourse());
            } else if (secondAlwaysRight) {
                courses.add(null);
            }
        }

        if (merge && courses.size() > 1 && courses.get(0) != null && courses.get(0) == courses.get(1)) {
            return new NametagCourses(Collections.singletonList(courses.get(0)), true);
        }
        return new NametagCourses(Collections.unmodifiableList(courses), false);
    }
}
