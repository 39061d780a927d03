package com.eventdocs.render.modules.event.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventdocs.render.modules.event.domain.Address;
import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.CourseTrack;
import com.eventdocs.render.modules.event.domain.CourseTrackStatus;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.Gender;
import com.eventdocs.render.modules.event.domain.Lodgement;
import com.eventdocs.render.modules.event.domain.Name;
import com.eventdocs.render.modules.event.domain.Persona;
import com.eventdocs.render.modules.event.domain.Registration;
import com.eventdocs.render.modules.event.domain.RegistrationPart;
import com.eventdocs.render.modules.event.domain.RegistrationPartStatus;
import com.eventdocs.render.modules.event.domain.RegistrationTrack;

class CrossLinkResolverTest {

    private final CrossLinkResolver resolver = new CrossLinkResolver();

    private EventPart first;
    private EventPart second;
    private EventTrack morning;
    private EventTrack evening;
    private Course course;
    private Lodgement lodgement;

    @BeforeEach
    void setUp() {
        first = new EventPart(1, "First", "1", LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 3));
        second = new EventPart(2, "Second", "2", LocalDate.of(2024, 7, 4), LocalDate.of(2024, 7, 6));
        morning = new EventTrack(11, "Morning", "M", 1, 2, first);
        evening = new EventTrack(12, "Evening", "E", 2, 1, second);
        first.addTrack(morning);
        second.addTrack(evening);
        course = new Course(101, "1", "Course", "C", Map.of());
        course.setTracks(Map.of(morning.getId(), new CourseTrack(course, morning, CourseTrackStatus.ACTIVE)));
        lodgement = new Lodgement(201, "Room", null, Map.of(), List.of(first, second));
    }

    private static Registration registration(int id, String given) {
        Persona persona = new Persona(id, new Name(null, given, "Doe", null, null), Gender.OTHER,
                LocalDate.of(2000, 1, 1), null, null, null, new Address(null, null, null, null, null), false);
        return new Registration(id, persona, 24, true, Map.of());
    }

    @Test
    @DisplayName("course tracks the export leaves out are not offered")
    void completesCourseTracks() {
        resolver.completeCourseTracks(course, List.of(morning, evening));

        assertThat(course.getTracks()).containsOnlyKeys(11, 12);
        assertThat(course.getTrack(morning).getStatus()).isEqualTo(CourseTrackStatus.ACTIVE);
        assertThat(course.getTrack(evening).getStatus()).isEqualTo(CourseTrackStatus.NOT_OFFERED);
        assertThat(course.getTrack(evening).getCourse()).isSameAs(course);
    }

    @Test
    @DisplayName("missing parts become not applied and missing tracks empty")
    void completesRegistration() {
        Registration registration = registration(1, "Jo");
        registration.setParts(Map.of(1, new RegistrationPart(registration, first,
                RegistrationPartStatus.PARTICIPANT, lodgement, false)));

        resolver.completeRegistration(registration, List.of(first, second), List.of(morning, evening));

        assertThat(registration.getPart(second).getStatus()).isEqualTo(RegistrationPartStatus.NOT_APPLIED);
        assertThat(registration.getPart(second).getLodgement()).isNull();
        assertThat(registration.getTrack(morning).getCourse()).isNull();
        assertThat(registration.getTrack(morning).getChoices()).hasSize(2).containsOnlyNulls();
        assertThat(registration.getTrack(evening).getChoices()).hasSize(1);
    }

    @Test
    @DisplayName("a track entry of a part without entry is dropped")
    void prunesTracksOfUnknownParts() {
        Registration registration = registration(1, "Jo");
        registration.setParts(Map.of(1, new RegistrationPart(registration, first,
                RegistrationPartStatus.PARTICIPANT, null, false)));
        registration.setTracks(Map.of(12, new RegistrationTrack(registration, evening, course, null, List.of())));

        resolver.resolve(List.of(first, second), List.of(morning, evening), List.of(course), List.of(registration));

        assertThat(registration.getTrack(evening).getCourse()).isNull();
        assertThat(course.getTrack(evening).getAttendees()).isEmpty();
    }

    @Test
    @DisplayName("attendees and inhabitants follow the order of the registrations")
    void wiresInRegistrationOrder() {
        Registration bea = registration(2, "Bea");
        Registration al = registration(1, "Al");
        for (Registration registration : List.of(bea, al)) {
            registration.setParts(Map.of(1, new RegistrationPart(registration, first,
                    RegistrationPartStatus.PARTICIPANT, lodgement, registration == al)));
        }
        al.setTracks(Map.of(11, new RegistrationTrack(al, morning, course, course, List.of(course))));
        bea.setTracks(Map.of(11, new RegistrationTrack(bea, morning, course, null, List.of(course))));

        resolver.resolve(List.of(first, second), List.of(morning, evening), List.of(course), List.of(al, bea));

        CourseTrack courseTrack = course.getTrack(morning);
        assertThat(courseTrack.getAttendees())
                .extracting(attendee -> attendee.registration().getId(), attendee -> attendee.instructor())
                .containsExactly(
                        tuple(1, true),
                        tuple(2, false));
        assertThat(courseTrack.getInstructors()).containsExactly(al);
        assertThat(lodgement.getPart(first).getInhabitants())
                .extracting(inhabitant -> inhabitant.registration().getId(), inhabitant -> inhabitant.campingMat())
                .containsExactly(
                        tuple(1, true),
                        tuple(2, false));
        assertThat(lodgement.getPart(second).getInhabitants()).isEmpty();
    }
}
