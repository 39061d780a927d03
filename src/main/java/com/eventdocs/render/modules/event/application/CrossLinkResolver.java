package com.eventdocs.render.modules.event.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.CourseTrack;
import com.eventdocs.render.modules.event.domain.CourseTrackStatus;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.event.domain.RegistrationPart;
import com.eventdocs.render.modules.event.domain.RegistrationTrack;

/**
 * Second pass over the primary entities: first fills in every part, track and course relation the export leaves out,
 * then appends attendees and inhabitants while walking the registrations in their final order. The two phases must
 * run in this order, attendee and inhabitant lists inherit the registration order from it.
 */
@Component
public class CrossLinkResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossLinkResolver.class);

    /**
     * @param registrations registrations in final sort order
     */
    public void resolve(List<EventPart> parts, List<EventTrack> tracks, List<Course> courses,
                        List<Registration> registrations) {
        for (Course course : courses) {
            completeCourseTracks(course, tracks);
        }
        for (Registration registration : registrations) {
            completeRegistration(registration, parts, tracks);
        }
        for (Registration registration : registrations) {
            wireBackReferences(registration);
        }
    }

    void completeCourseTracks(Course course, List<EventTrack> tracks) {
        Map<Integer, CourseTrack> explicit = course.getTracks();
        Map<Integer, CourseTrack> complete = new LinkedHashMap<>();
        for (EventTrack track : tracks) {
            CourseTrack courseTrack = explicit.get(track.getId());
            complete.put(track.getId(), courseTrack != null
                    ? courseTrack
                    : new CourseTrack(course, track, CourseTrackStatus.NOT_OFFERED));
        }
        course.setTracks(complete);
    }

    /**
     * Adds a not-applied part for every part the export does not mention and an empty track for every track without
     * entry. Exported track entries of parts without part entry are replaced by empty ones.
     */
    void completeRegistration(Registration registration, List<EventPart> parts, List<EventTrack> tracks) {
        Map<Integer, RegistrationPart> explicitParts = registration.getParts();
        Map<Integer, RegistrationTrack> explicitTracks = registration.getTracks();

        Map<Integer, RegistrationPart> completeParts = new LinkedHashMap<>();
        for (EventPart part : parts) {
            RegistrationPart registrationPart = explicitParts.get(part.getId());
            completeParts.put(part.getId(), registrationPart != null
                    ? registrationPart
                    : RegistrationPart.notApplied(registration, part));
        }

        Map<Integer, RegistrationTrack> completeTracks = new LinkedHashMap<>();
        for (EventTrack track : tracks) {
            RegistrationTrack registrationTrack = explicitTracks.get(track.getId());
            if (registrationTrack != null && !explicitParts.containsKey(track.getPart().getId())) {
                log.debug("Dropping track {} of registration {}: no entry for part {}",
                        track.getId(), registration.getId(), track.getPart().getId());
                registrationTrack = null;
            }
            completeTracks.put(track.getId(), registrationTrack != null
                    ? registrationTrack
                    : RegistrationTrack.empty(registration, track));
        }

        registration.setParts(completeParts);
        registration.setTracks(completeTracks);
    }

    void wireBackReferences(Registration registration) {
        for (RegistrationPart registrationPart : registration.getParts().values()) {
            if (registrationPart.getLodgement() != null) {
                registrationPart.getLodgement()
                        .getPart(registrationPart.getPart())
                        .addInhabitant(registration, registrationPart.isCampingMat());
            }
        }
        for (RegistrationTrack registrationTrack : registration.getTracks().values()) {
            Course course = registrationTrack.getCourse();
            if (course != null) {
                course.getTrack(registrationTrack.getTrack())
                        .addAttendee(registration, registrationTrack.isInstructor());
            }
        }
    }
}
